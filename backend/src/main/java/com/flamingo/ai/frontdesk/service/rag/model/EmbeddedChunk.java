package com.flamingo.ai.frontdesk.service.rag.model;

import java.util.List;

/**
 * A chunk together with its embedding, ready to be stored.
 *
 * @param chunk the chunk text, position and metadata
 * @param embedding the embedding vector of the chunk text
 */
public record EmbeddedChunk(TextChunk chunk, List<Float> embedding) {}
