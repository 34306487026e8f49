package com.flamingo.ai.frontdesk.service.rag.model;

import java.util.Map;

/**
 * A single chunk produced by the
 * {@link com.flamingo.ai.frontdesk.service.rag.chunking.TextChunker}, before embedding.
 *
 * @param content trimmed chunk text
 * @param chunkIndex sequential position within the document (0-based, continuous across pages)
 * @param metadata chunk metadata, e.g. {@code page_number} for PDF chunks
 */
public record TextChunk(String content, int chunkIndex, Map<String, Object> metadata) {}
