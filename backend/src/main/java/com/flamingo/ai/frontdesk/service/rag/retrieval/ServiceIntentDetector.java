package com.flamingo.ai.frontdesk.service.rag.retrieval;

import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds the service a query is about.
 *
 * <p>A service matches when its whole name occurs in the query on word boundaries, ignoring case.
 * When several match, the longest name wins, then the lower display order, then the name, so the
 * outcome does not depend on the order services are loaded in.
 */
@Component
public class ServiceIntentDetector {

  private static final Comparator<ServiceOffering> PREFERENCE =
      Comparator.comparingInt((ServiceOffering s) -> s.getName().strip().length())
          .reversed()
          .thenComparingInt(ServiceOffering::getDisplayOrder)
          .thenComparing(s -> s.getName().strip(), String.CASE_INSENSITIVE_ORDER);

  public Optional<ServiceOffering> detect(String query, List<ServiceOffering> services) {
    if (query == null || query.isBlank() || services.isEmpty()) {
      return Optional.empty();
    }
    String normalizedQuery = query.toLowerCase(Locale.ROOT);
    return services.stream()
        .filter(ServiceOffering::isActive)
        .filter(s -> s.getName() != null && !s.getName().isBlank())
        .filter(s -> mentions(normalizedQuery, s.getName()))
        .min(PREFERENCE);
  }

  static boolean mentions(String normalizedQuery, String serviceName) {
    String name = serviceName.strip().toLowerCase(Locale.ROOT);
    Pattern pattern =
        Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])");
    return pattern.matcher(normalizedQuery).find();
  }
}
