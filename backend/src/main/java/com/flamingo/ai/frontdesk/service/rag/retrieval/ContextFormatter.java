package com.flamingo.ai.frontdesk.service.rag.retrieval;

import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved knowledge as prompt context for the conversation model.
 *
 * <p>The detected service, if any, comes first as a block of its structured fields. Chunks follow
 * inside a fixed banner, each under a provenance header naming its source document, related
 * service, match score and page.
 */
@Component
public class ContextFormatter {

  static final String BANNER = "=".repeat(60);
  static final String RULE = "-".repeat(40);
  static final String PREAMBLE = "RELEVANT BUSINESS INFORMATION (USE THIS TO ANSWER)";
  static final String POSTAMBLE =
      "IMPORTANT: Use the SPECIFIC information above to answer the customer's question.\n"
          + "Do NOT give generic responses when specific details are provided.\n"
          + "Cite the source you used, e.g. \"according to our cancellation policy\".";

  /**
   * Formats the context.
   *
   * @param service detected service, or null
   * @param chunks retrieved chunks in rank order
   * @return the context, or an empty string when there is neither a service nor a chunk
   */
  public String format(ServiceOffering service, List<RetrievedChunk> chunks) {
    StringBuilder context = new StringBuilder();
    if (service != null) {
      context.append(formatService(service));
    }
    if (!chunks.isEmpty()) {
      if (context.length() > 0) {
        context.append("\n\n");
      }
      context.append(formatChunks(chunks));
    }
    return context.toString();
  }

  String formatService(ServiceOffering service) {
    StringBuilder block = new StringBuilder();
    block.append("=== SERVICE INFORMATION ===\n");
    block.append("Service: ").append(service.getName().strip()).append('\n');
    if (service.getDescription() != null && !service.getDescription().isBlank()) {
      block.append("Description: ").append(service.getDescription().strip()).append('\n');
    }
    block.append("Price: ").append(service.formattedPrice()).append('\n');
    block.append("Duration: ").append(service.formattedDuration()).append('\n');
    block.append("=== END SERVICE INFORMATION ===");
    return block.toString();
  }

  String formatChunks(List<RetrievedChunk> chunks) {
    StringBuilder block = new StringBuilder();
    block.append(BANNER).append('\n').append(PREAMBLE).append('\n').append(BANNER).append('\n');

    for (int i = 0; i < chunks.size(); i++) {
      RetrievedChunk chunk = chunks.get(i);
      block.append('\n').append(header(i + 1, chunk)).append('\n');
      block.append(body(chunk)).append('\n');
      block.append(RULE).append('\n');
    }

    block.append('\n').append(POSTAMBLE);
    return block.toString();
  }

  static String header(int position, RetrievedChunk chunk) {
    StringBuilder header = new StringBuilder();
    header.append("[Source ").append(position).append(": ").append(chunk.documentTitle());
    if (chunk.documentType() != null) {
      header.append(" (").append(chunk.documentType().label()).append(')');
    }
    if (chunk.serviceName() != null) {
      header.append(" | Service: ").append(chunk.serviceName());
    }
    header.append(" | ").append(chunk.score().label());
    chunk.pageNumber().ifPresent(page -> header.append(" | Page ").append(page));
    header.append(']');
    return header.toString();
  }

  static String body(RetrievedChunk chunk) {
    return chunk
        .answer()
        .map(answer -> "Q: " + chunk.content().strip() + "\nA: " + answer.strip())
        .orElse(chunk.content());
  }
}
