package com.flamingo.ai.frontdesk.service.indexing;

/**
 * One synthesized knowledge entry: the question is embedded and matched, the answer is surfaced.
 *
 * @param question text that gets indexed
 * @param answer text returned to the caller when the question matches
 */
public record QuestionAnswer(String question, String answer) {}
