package com.flamingo.ai.frontdesk.service.indexing;

import com.flamingo.ai.frontdesk.domain.enums.KnowledgeField;
import java.util.List;
import java.util.UUID;

/**
 * A document generated from one entry of a structured business field, before it is stored.
 *
 * @param field the field the entry comes from
 * @param title document title
 * @param relatedServiceId service the entry describes, for service catalog entries
 * @param entries question variants sharing the entry's answer
 */
public record SyntheticDocument(
    KnowledgeField field, String title, UUID relatedServiceId, List<QuestionAnswer> entries) {}
