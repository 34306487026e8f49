package com.flamingo.ai.frontdesk.service.indexing;

import com.flamingo.ai.frontdesk.domain.entity.Business;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.enums.KnowledgeField;
import com.flamingo.ai.frontdesk.service.rag.model.TextChunk;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns structured business fields into question/answer documents.
 *
 * <p>Generation is deterministic: the same business data always yields the same documents in the
 * same order. Every entry becomes one document whose chunks are question variants; the shared
 * answer travels in chunk metadata under {@link DocumentChunk#ANSWER_KEY}.
 *
 * <p>Stored document content is the {@code Q:}/{@code A:} rendering of the entries, so a plain
 * reindex of the document produces the same chunks again.
 */
@Component
@Slf4j
public class KnowledgeSynthesizer {

  static final String QUESTION_PREFIX = "Q: ";
  static final String ANSWER_PREFIX = "A: ";
  static final String CONTINUATION_INDENT = "  ";

  /** Generates the documents for every field of a business. */
  public List<SyntheticDocument> synthesize(Business business, List<ServiceOffering> services) {
    List<SyntheticDocument> documents = new ArrayList<>();
    for (KnowledgeField field : KnowledgeField.values()) {
      documents.addAll(synthesize(business, services, field));
    }
    log.info("Prepared {} synthetic documents for business {}", documents.size(), business.getId());
    return documents;
  }

  /** Generates the documents for one field of a business. */
  public List<SyntheticDocument> synthesize(
      Business business, List<ServiceOffering> services, KnowledgeField field) {
    return switch (field) {
      case BUSINESS_PROFILE -> profileDocuments(business.getBusinessProfile());
      case SERVICE_CATALOG -> serviceDocuments(services);
      case CONVERSATION_POLICIES -> policyDocuments(business.getConversationPolicies());
      case QUICK_RESPONSES -> quickResponseDocuments(business.getQuickResponses());
      case CONTACT_INFO -> contactDocuments(business.getContactInfo());
      case AI_INSTRUCTIONS -> instructionDocuments(business.getAiInstructions());
    };
  }

  private List<SyntheticDocument> profileDocuments(Map<String, Object> profile) {
    List<SyntheticDocument> documents = new ArrayList<>();
    if (profile == null) {
      return documents;
    }

    String areas = joined(profile.get("areas_served"));
    if (!areas.isEmpty()) {
      documents.add(
          document(
              KnowledgeField.BUSINESS_PROFILE,
              "Service Areas",
              null,
              List.of(
                  new QuestionAnswer("What areas do you serve?", "We serve " + areas + "."),
                  new QuestionAnswer("Where do you provide services?", "We cover " + areas + "."),
                  new QuestionAnswer("What locations do you cover?", "We serve " + areas + "."))));
    }

    String description = text(profile.get("description"));
    if (!description.isEmpty()) {
      documents.add(
          document(
              KnowledgeField.BUSINESS_PROFILE,
              "Business Description",
              null,
              List.of(
                  new QuestionAnswer("What does your business do?", description),
                  new QuestionAnswer("Tell me about your company", description),
                  new QuestionAnswer("What services do you offer?", description))));
    }

    String specialties = joined(profile.get("specialties"));
    if (!specialties.isEmpty()) {
      String answer = "We specialize in " + specialties + ".";
      documents.add(
          document(
              KnowledgeField.BUSINESS_PROFILE,
              "Specialties",
              null,
              List.of(
                  new QuestionAnswer("What are your specialties?", answer),
                  new QuestionAnswer("What do you specialize in?", answer))));
    }
    return documents;
  }

  private List<SyntheticDocument> serviceDocuments(List<ServiceOffering> services) {
    List<SyntheticDocument> documents = new ArrayList<>();
    for (ServiceOffering service : services) {
      if (!service.isActive() || service.getName() == null || service.getName().isBlank()) {
        continue;
      }
      String name = service.getName().strip();
      String answer = serviceAnswer(service);

      List<QuestionAnswer> entries = new ArrayList<>();
      entries.add(new QuestionAnswer("Tell me about your " + name + " service", answer));
      entries.add(new QuestionAnswer("Do you offer " + name + "?", "Yes, " + answer));
      entries.add(new QuestionAnswer("What is " + name + "?", answer));
      if (service.hasPrice()) {
        String price = service.formattedPrice();
        entries.add(
            new QuestionAnswer(
                "How much does " + name + " cost?", "The " + name + " costs " + price));
        entries.add(new QuestionAnswer("What is the price of " + name + "?", price));
      }
      documents.add(
          document(KnowledgeField.SERVICE_CATALOG, "Service: " + name, service.getId(), entries));
    }
    return documents;
  }

  static String serviceAnswer(ServiceOffering service) {
    List<String> details = new ArrayList<>();
    if (service.getDescription() != null && !service.getDescription().isBlank()) {
      details.add(service.getDescription().strip());
    }
    if (service.hasPrice()) {
      details.add("Price: " + service.formattedPrice());
    }
    if (service.getDuration() != null && service.getDuration() > 0) {
      details.add("Duration: " + service.formattedDuration());
    }
    if (details.isEmpty()) {
      return "We offer " + service.getName().strip() + ".";
    }
    return String.join(". ", details);
  }

  private List<SyntheticDocument> policyDocuments(Map<String, Object> policies) {
    List<SyntheticDocument> documents = new ArrayList<>();
    if (policies == null) {
      return documents;
    }
    for (Map.Entry<String, Object> policy : policies.entrySet()) {
      if (!(policy.getValue() instanceof String value) || value.isBlank()) {
        continue;
      }
      String policyName = policy.getKey().replace('_', ' ').strip();
      String answer = value.strip();
      documents.add(
          document(
              KnowledgeField.CONVERSATION_POLICIES,
              "Policy: " + policyName,
              null,
              List.of(
                  new QuestionAnswer("What is your " + policyName + "?", answer),
                  new QuestionAnswer("Can you explain your " + policyName + "?", answer),
                  new QuestionAnswer("Tell me about your " + policyName, answer))));
    }
    return documents;
  }

  private List<SyntheticDocument> quickResponseDocuments(Map<String, Object> quickResponses) {
    List<SyntheticDocument> documents = new ArrayList<>();
    if (quickResponses == null) {
      return documents;
    }
    for (Map.Entry<String, Object> response : quickResponses.entrySet()) {
      String question = singleLine(response.getKey());
      String answer = text(response.getValue());
      if (question.isEmpty() || answer.isEmpty()) {
        continue;
      }
      documents.add(
          document(
              KnowledgeField.QUICK_RESPONSES,
              "FAQ: " + question,
              null,
              List.of(new QuestionAnswer(question, answer))));
    }
    return documents;
  }

  private List<SyntheticDocument> contactDocuments(Map<String, Object> contact) {
    List<SyntheticDocument> documents = new ArrayList<>();
    if (contact == null) {
      return documents;
    }
    String address = text(contact.get("address"));
    String email = text(contact.get("email"));
    String website = text(contact.get("website"));
    String phone = text(contact.get("office_phone"));
    String emergency = text(contact.get("emergency_line"));

    if (!address.isEmpty()) {
      documents.add(
          contact(
              "Address",
              new QuestionAnswer("What is your address?", address),
              new QuestionAnswer("Where are you located?", address)));
    }
    if (!email.isEmpty()) {
      documents.add(
          contact(
              "Email",
              new QuestionAnswer("What is your email?", email),
              new QuestionAnswer("How can I email you?", "You can reach us at " + email)));
    }
    if (!website.isEmpty()) {
      documents.add(contact("Website", new QuestionAnswer("What is your website?", website)));
    }
    if (!phone.isEmpty()) {
      documents.add(
          contact(
              "Phone",
              new QuestionAnswer("What is your phone number?", phone),
              new QuestionAnswer("How can I call you?", "You can reach us at " + phone)));
    }
    if (!emergency.isEmpty()) {
      documents.add(
          contact(
              "Emergency Line",
              new QuestionAnswer(
                  "Do you have an emergency contact?",
                  "Yes, our emergency line is " + emergency)));
    }

    List<String> methods = new ArrayList<>();
    if (!phone.isEmpty()) {
      methods.add("call us at " + phone);
    }
    if (!email.isEmpty()) {
      methods.add("email " + email);
    }
    if (!website.isEmpty()) {
      methods.add("visit " + website);
    }
    if (!methods.isEmpty()) {
      documents.add(
          contact(
              "How To Reach Us",
              new QuestionAnswer(
                  "How can I contact you?", "You can " + String.join(", ", methods))));
    }
    return documents;
  }

  private List<SyntheticDocument> instructionDocuments(String instructions) {
    if (instructions == null || instructions.isBlank()) {
      return List.of();
    }
    return List.of(
        document(
            KnowledgeField.AI_INSTRUCTIONS,
            "AI Instructions",
            null,
            List.of(
                new QuestionAnswer(
                    "Are there any special instructions for handling customers?",
                    instructions.strip()))));
  }

  /**
   * Renders entries as stored document content.
   *
   * @return {@code Q: question} / {@code A: answer} pairs separated by blank lines; every answer
   *     line after the first is indented so it can never start a new pair
   */
  public String render(List<QuestionAnswer> entries) {
    return entries.stream()
        .map(
            entry ->
                QUESTION_PREFIX
                    + entry.question().replace('\n', ' ')
                    + "\n"
                    + ANSWER_PREFIX
                    + entry.answer().replace("\n", "\n" + CONTINUATION_INDENT))
        .collect(Collectors.joining("\n\n"));
  }

  /**
   * Parses content produced by {@link #render(List)}. Indented lines continue the current answer;
   * an unindented blank line ends it.
   */
  public List<QuestionAnswer> parse(String content) {
    List<QuestionAnswer> entries = new ArrayList<>();
    if (content == null || content.isBlank()) {
      return entries;
    }

    String question = null;
    StringBuilder answer = null;
    for (String line : content.split("\n", -1)) {
      if (answer != null && line.startsWith(CONTINUATION_INDENT)) {
        answer.append('\n').append(line.substring(CONTINUATION_INDENT.length()));
      } else if (line.startsWith(QUESTION_PREFIX)) {
        addEntry(entries, question, answer);
        question = line.substring(QUESTION_PREFIX.length()).strip();
        answer = null;
      } else if (question != null && answer == null && line.startsWith(ANSWER_PREFIX)) {
        answer = new StringBuilder(line.substring(ANSWER_PREFIX.length()));
      } else if (answer != null && !line.isBlank()) {
        // hand-written content without indentation
        answer.append('\n').append(line);
      }
    }
    addEntry(entries, question, answer);
    return entries;
  }

  /** Converts synthetic document content into question chunks carrying their answers. */
  public List<TextChunk> toChunks(String content) {
    List<QuestionAnswer> entries = parse(content);
    List<TextChunk> chunks = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      QuestionAnswer entry = entries.get(i);
      chunks.add(
          new TextChunk(entry.question(), i, Map.of(DocumentChunk.ANSWER_KEY, entry.answer())));
    }
    return chunks;
  }

  private static void addEntry(
      List<QuestionAnswer> entries, String question, StringBuilder answer) {
    if (question == null || question.isEmpty() || answer == null) {
      return;
    }
    String text = answer.toString().strip();
    if (!text.isEmpty()) {
      entries.add(new QuestionAnswer(question, text));
    }
  }

  private static SyntheticDocument document(
      KnowledgeField field, String title, UUID serviceId, List<QuestionAnswer> entries) {
    return new SyntheticDocument(field, title, serviceId, List.copyOf(entries));
  }

  private static SyntheticDocument contact(String label, QuestionAnswer... entries) {
    return document(KnowledgeField.CONTACT_INFO, "Contact: " + label, null, List.of(entries));
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString().strip();
  }

  private static String singleLine(String value) {
    return value == null ? "" : value.replaceAll("\\s+", " ").strip();
  }

  private static String joined(Object value) {
    if (value instanceof Collection<?> items) {
      return items.stream()
          .map(KnowledgeSynthesizer::text)
          .filter(item -> !item.isEmpty())
          .collect(Collectors.joining(", "));
    }
    return text(value);
  }
}
