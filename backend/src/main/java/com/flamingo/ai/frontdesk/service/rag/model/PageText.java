package com.flamingo.ai.frontdesk.service.rag.model;

/**
 * Text of one extracted page.
 *
 * @param pageNumber 1-based page number
 * @param text extracted text of the page
 */
public record PageText(int pageNumber, String text) {}
