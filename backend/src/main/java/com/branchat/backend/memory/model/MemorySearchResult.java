package com.branchat.backend.memory.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Ranked memory entry. The score scale depends on the search mode but is always "higher is better". */
public record MemorySearchResult(
    UUID subChatId,
    UUID conversationId,
    double score,
    String summary,
    List<String> keywords,
    List<String> actions,
    List<String> artifacts,
    Instant createdAt,
    Instant mergedAt) {}
