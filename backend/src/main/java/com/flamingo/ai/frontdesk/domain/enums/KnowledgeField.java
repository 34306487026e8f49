package com.flamingo.ai.frontdesk.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structured business fields that synthetic question/answer documents are generated from. The key
 * is the name callers use when reporting which fields changed.
 */
public enum KnowledgeField {
  BUSINESS_PROFILE("business_profile", DocumentType.GENERAL),
  SERVICE_CATALOG("service_catalog", DocumentType.GENERAL),
  CONVERSATION_POLICIES("conversation_policies", DocumentType.POLICY),
  QUICK_RESPONSES("quick_responses", DocumentType.FAQ),
  CONTACT_INFO("contact_info", DocumentType.GENERAL),
  AI_INSTRUCTIONS("ai_instructions", DocumentType.GUIDE);

  private final String key;
  private final DocumentType documentType;

  KnowledgeField(String key, DocumentType documentType) {
    this.key = key;
    this.documentType = documentType;
  }

  public String getKey() {
    return key;
  }

  /** Type given to the synthetic documents generated from this field. */
  public DocumentType getDocumentType() {
    return documentType;
  }

  public static Optional<KnowledgeField> fromKey(String key) {
    return Arrays.stream(values()).filter(field -> field.key.equalsIgnoreCase(key)).findFirst();
  }
}
