package com.flamingo.ai.frontdesk.service.rag.retrieval;

/**
 * Context text together with the diagnostics that produced it.
 *
 * @param context formatted context; empty when nothing relevant was found or retrieval failed
 * @param debugInfo diagnostics of the call
 */
public record RetrievalResult(String context, RetrievalDebugInfo debugInfo) {}
