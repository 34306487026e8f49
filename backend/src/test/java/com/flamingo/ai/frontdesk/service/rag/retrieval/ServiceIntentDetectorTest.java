package com.flamingo.ai.frontdesk.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceIntentDetector Tests")
class ServiceIntentDetectorTest {

  private final ServiceIntentDetector detector = new ServiceIntentDetector();

  private static ServiceOffering service(String name, int displayOrder) {
    return ServiceOffering.builder()
        .id(UUID.randomUUID())
        .businessId(UUID.randomUUID())
        .name(name)
        .displayOrder(displayOrder)
        .build();
  }

  @Test
  @DisplayName("Should detect a service named in the query, ignoring case")
  void shouldDetectNamedService() {
    ServiceOffering haircut = service("Haircut", 0);
    ServiceOffering massage = service("Massage", 1);

    assertThat(detector.detect("How much is a HAIRCUT?", List.of(massage, haircut)))
        .contains(haircut);
  }

  @Test
  @DisplayName("Should only match whole words")
  void shouldMatchWholeWordsOnly() {
    ServiceOffering hair = service("Hair", 0);

    assertThat(detector.detect("Do you do haircuts?", List.of(hair))).isEmpty();
    assertThat(detector.detect("Is hair washing included?", List.of(hair))).contains(hair);
  }

  @Test
  @DisplayName("Should prefer the longest matching name regardless of load order")
  void shouldPreferLongestName() {
    ServiceOffering cut = service("Cut", 0);
    ServiceOffering cutAndColor = service("Cut and Color", 5);
    String query = "price for a cut and color please";

    assertThat(detector.detect(query, List.of(cut, cutAndColor))).contains(cutAndColor);
    assertThat(detector.detect(query, List.of(cutAndColor, cut))).contains(cutAndColor);
  }

  @Test
  @DisplayName("Should ignore inactive services")
  void shouldIgnoreInactiveServices() {
    ServiceOffering haircut = service("Haircut", 0);
    haircut.setActive(false);

    assertThat(detector.detect("haircut price", List.of(haircut))).isEmpty();
  }

  @Test
  @DisplayName("Should return empty when nothing is mentioned")
  void shouldReturnEmptyWhenNothingMatches() {
    assertThat(detector.detect("Where do I park?", List.of(service("Haircut", 0)))).isEmpty();
    assertThat(detector.detect("haircut", List.of())).isEmpty();
  }
}
