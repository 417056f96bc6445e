package com.branchat.backend.memory.model;

import java.util.UUID;

/**
 * @param topK maximum number of results
 * @param threshold minimum cosine similarity for vector results
 * @param excludeConversationId entries merged into this conversation are skipped
 */
public record MemorySearchOptions(int topK, double threshold, UUID excludeConversationId) {

  public MemorySearchOptions {
    topK = Math.max(topK, 0);
  }
}
