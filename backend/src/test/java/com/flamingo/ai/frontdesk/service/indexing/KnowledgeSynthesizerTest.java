package com.flamingo.ai.frontdesk.service.indexing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.frontdesk.domain.entity.Business;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.enums.KnowledgeField;
import com.flamingo.ai.frontdesk.service.rag.model.TextChunk;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KnowledgeSynthesizer Tests")
class KnowledgeSynthesizerTest {

  private final KnowledgeSynthesizer synthesizer = new KnowledgeSynthesizer();

  private static Business business() {
    Map<String, Object> profile = new LinkedHashMap<>();
    profile.put("description", "Neighbourhood barber shop.");
    profile.put("areas_served", List.of("Downtown", "Riverside"));
    profile.put("specialties", List.of("fades", "beard trims"));

    Map<String, Object> policies = new LinkedHashMap<>();
    policies.put("cancellation_policy", "24 hours notice is required.");
    policies.put("deposit_rules", Map.of("amount", 10));

    Map<String, Object> quickResponses = new LinkedHashMap<>();
    quickResponses.put("What are your hours?", "9-5 Mon-Fri.");

    Map<String, Object> contact = new LinkedHashMap<>();
    contact.put("office_phone", "555-0100");
    contact.put("email", "hello@barber.test");

    return Business.builder()
        .id(UUID.randomUUID())
        .name("Main Street Barber")
        .businessProfile(profile)
        .conversationPolicies(policies)
        .quickResponses(quickResponses)
        .contactInfo(contact)
        .aiInstructions("Always offer the next free slot.")
        .build();
  }

  private static ServiceOffering haircut() {
    return ServiceOffering.builder()
        .id(UUID.randomUUID())
        .name("Haircut")
        .description("Classic cut and style")
        .price(new BigDecimal("30"))
        .duration(30)
        .build();
  }

  @Nested
  @DisplayName("services")
  class ServiceTests {

    @Test
    @DisplayName("Should generate price questions for a priced service")
    void shouldGeneratePricedServiceDocument() {
      ServiceOffering haircut = haircut();

      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(haircut), KnowledgeField.SERVICE_CATALOG);

      assertThat(documents).hasSize(1);
      SyntheticDocument document = documents.get(0);
      assertThat(document.title()).isEqualTo("Service: Haircut");
      assertThat(document.relatedServiceId()).isEqualTo(haircut.getId());
      assertThat(document.entries())
          .extracting(QuestionAnswer::question)
          .containsExactly(
              "Tell me about your Haircut service",
              "Do you offer Haircut?",
              "What is Haircut?",
              "How much does Haircut cost?",
              "What is the price of Haircut?");
      assertThat(document.entries())
          .extracting(QuestionAnswer::answer)
          .containsExactly(
              "Classic cut and style. Price: $30. Duration: 30m",
              "Yes, Classic cut and style. Price: $30. Duration: 30m",
              "Classic cut and style. Price: $30. Duration: 30m",
              "The Haircut costs $30",
              "$30");
    }

    @Test
    @DisplayName("Should fall back to a plain answer for a service without details")
    void shouldHandleServiceWithoutDetails() {
      ServiceOffering walkIn = ServiceOffering.builder().name(" Walk-in ").build();

      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(walkIn), KnowledgeField.SERVICE_CATALOG);

      assertThat(documents.get(0).entries()).hasSize(3);
      assertThat(documents.get(0).entries().get(0).answer()).isEqualTo("We offer Walk-in.");
    }

    @Test
    @DisplayName("Should skip inactive and unnamed services")
    void shouldSkipInactiveServices() {
      ServiceOffering inactive = haircut();
      inactive.setActive(false);
      ServiceOffering unnamed = ServiceOffering.builder().name(" ").build();

      assertThat(
              synthesizer.synthesize(
                  business(), List.of(inactive, unnamed), KnowledgeField.SERVICE_CATALOG))
          .isEmpty();
    }
  }

  @Nested
  @DisplayName("business fields")
  class BusinessFieldTests {

    @Test
    @DisplayName("Should build profile documents from description, areas and specialties")
    void shouldBuildProfileDocuments() {
      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(), KnowledgeField.BUSINESS_PROFILE);

      assertThat(documents)
          .extracting(SyntheticDocument::title)
          .containsExactly("Service Areas", "Business Description", "Specialties");
      assertThat(documents.get(0).entries().get(0).answer())
          .isEqualTo("We serve Downtown, Riverside.");
      assertThat(documents.get(2).entries().get(0).answer())
          .isEqualTo("We specialize in fades, beard trims.");
    }

    @Test
    @DisplayName("Should turn policy keys into words and skip structured values")
    void shouldBuildPolicyDocuments() {
      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(), KnowledgeField.CONVERSATION_POLICIES);

      assertThat(documents).hasSize(1);
      assertThat(documents.get(0).title()).isEqualTo("Policy: cancellation policy");
      assertThat(documents.get(0).entries().get(0).question())
          .isEqualTo("What is your cancellation policy?");
    }

    @Test
    @DisplayName("Should build one FAQ document per quick response")
    void shouldBuildQuickResponseDocuments() {
      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(), KnowledgeField.QUICK_RESPONSES);

      assertThat(documents).hasSize(1);
      assertThat(documents.get(0).title()).isEqualTo("FAQ: What are your hours?");
      assertThat(documents.get(0).entries())
          .containsExactly(new QuestionAnswer("What are your hours?", "9-5 Mon-Fri."));
    }

    @Test
    @DisplayName("Should build contact documents and a summary of contact methods")
    void shouldBuildContactDocuments() {
      List<SyntheticDocument> documents =
          synthesizer.synthesize(business(), List.of(), KnowledgeField.CONTACT_INFO);

      assertThat(documents)
          .extracting(SyntheticDocument::title)
          .containsExactly("Contact: Email", "Contact: Phone", "Contact: How To Reach Us");
      assertThat(documents.get(2).entries().get(0).answer())
          .isEqualTo("You can call us at 555-0100, email hello@barber.test");
    }

    @Test
    @DisplayName("Should produce the same documents for the same data")
    void shouldBeDeterministic() {
      Business business = business();
      List<ServiceOffering> services = List.of(haircut());

      assertThat(synthesizer.synthesize(business, services))
          .isEqualTo(synthesizer.synthesize(business, services));
    }

    @Test
    @DisplayName("Should produce nothing for an empty business")
    void shouldHandleEmptyBusiness() {
      Business empty = Business.builder().id(UUID.randomUUID()).name("Empty").build();

      assertThat(synthesizer.synthesize(empty, List.of())).isEmpty();
    }
  }

  @Nested
  @DisplayName("stored content")
  class StoredContentTests {

    @Test
    @DisplayName("Should parse rendered content back into its entries")
    void shouldParseRenderedContent() {
      List<QuestionAnswer> entries =
          List.of(
              new QuestionAnswer("What is your address?", "1 Main St\nSuite 2"),
              new QuestionAnswer("Where are you located?", "1 Main St"));

      String content = synthesizer.render(entries);

      assertThat(content)
          .isEqualTo(
              "Q: What is your address?\nA: 1 Main St\n  Suite 2\n\n"
                  + "Q: Where are you located?\nA: 1 Main St");
      assertThat(synthesizer.parse(content)).isEqualTo(entries);
    }

    @Test
    @DisplayName("Should keep answer lines that look like questions")
    void shouldKeepQuestionLikeAnswerLines() {
      String answer =
          "Always confirm the booking.\nQ: customers often ask about refunds\nTell them 48h.";
      List<QuestionAnswer> entries =
          List.of(
              new QuestionAnswer("Any special instructions?", answer),
              new QuestionAnswer("Do you take cards?", "Yes."));

      List<TextChunk> chunks = synthesizer.toChunks(synthesizer.render(entries));

      assertThat(chunks).hasSize(2);
      assertThat(chunks.get(0).metadata()).containsEntry(DocumentChunk.ANSWER_KEY, answer);
      assertThat(chunks.get(1).content()).isEqualTo("Do you take cards?");
    }

    @Test
    @DisplayName("Should keep blank lines and indentation inside answers")
    void shouldKeepAnswerLayout() {
      List<QuestionAnswer> entries =
          List.of(
              new QuestionAnswer(
                  "What is your cancellation policy?",
                  "Cancel 24h ahead.\n\nA: late cancellations\n  are charged $10."));

      assertThat(synthesizer.parse(synthesizer.render(entries))).isEqualTo(entries);
    }

    @Test
    @DisplayName("Should still read unindented hand-written answers")
    void shouldReadUnindentedAnswers() {
      assertThat(synthesizer.parse("Q: Hours?\nA: 9-5\nweekends closed"))
          .containsExactly(new QuestionAnswer("Hours?", "9-5\nweekends closed"));
    }

    @Test
    @DisplayName("Should turn content into question chunks with answers in metadata")
    void shouldBuildChunks() {
      List<TextChunk> chunks =
          synthesizer.toChunks("Q: Do you take cards?\nA: Yes, all major cards.");

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).content()).isEqualTo("Do you take cards?");
      assertThat(chunks.get(0).chunkIndex()).isZero();
      assertThat(chunks.get(0).metadata())
          .containsEntry(DocumentChunk.ANSWER_KEY, "Yes, all major cards.");
    }

    @Test
    @DisplayName("Should ignore questions without answers")
    void shouldIgnoreQuestionsWithoutAnswers() {
      assertThat(synthesizer.parse("Q: Orphan question\n\nQ: Real?\nA: Yes.")).hasSize(1);
      assertThat(synthesizer.parse("plain text")).isEmpty();
    }
  }
}
