package com.branchat.backend.memory.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Content of a memory entry as written at merge time. */
public record MemoryDocument(
    UUID conversationId,
    String userId,
    String summary,
    List<String> keywords,
    List<String> actions,
    List<String> artifacts,
    Instant createdAt,
    Instant mergedAt) {

  public MemoryDocument {
    Objects.requireNonNull(conversationId, "conversationId must not be null");
    Objects.requireNonNull(userId, "userId must not be null");
    summary = summary != null ? summary : "";
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
    actions = actions != null ? List.copyOf(actions) : List.of();
    artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
  }

  /** Text embedded for vector search: the summary followed by the keywords. */
  public String embeddingText() {
    return summary + " " + String.join(" ", keywords);
  }
}
