package com.branchat.backend.memory.service;

import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.branchat.backend.memory.config.MemoryProperties;
import com.branchat.backend.memory.model.MemoryDocument;
import com.branchat.backend.memory.model.MemorySearchOptions;
import com.branchat.backend.memory.model.MemorySearchResult;
import com.branchat.backend.memory.model.MemoryStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Long-term memory operations used by the merge pipeline, context preview and the memory API.
 * Everything here degrades to empty results or {@code false} when the index is unavailable.
 */
@Service
public class MemoryService {

  private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

  private final MemoryIndex memoryIndex;
  private final MemoryProperties properties;
  private final Clock clock;
  private final Counter storedCounter;
  private final Counter storeFailureCounter;

  @Autowired
  public MemoryService(
      MemoryIndex memoryIndex, MemoryProperties properties, MeterRegistry meterRegistry) {
    this(memoryIndex, properties, meterRegistry, Clock.systemUTC());
  }

  MemoryService(
      MemoryIndex memoryIndex, MemoryProperties properties, MeterRegistry meterRegistry, Clock clock) {
    this.memoryIndex = Objects.requireNonNull(memoryIndex, "memoryIndex must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.storedCounter = meterRegistry != null ? meterRegistry.counter("memory_store_total") : null;
    this.storeFailureCounter =
        meterRegistry != null ? meterRegistry.counter("memory_store_failures_total") : null;
  }

  public boolean isAvailable() {
    return memoryIndex.isAvailable();
  }

  /**
   * Stores the summary of a merged sub-conversation. When its vector cannot be computed the entry is
   * stored anyway and remains reachable through lexical search.
   *
   * @return {@code true} when the entry was written
   */
  public boolean storeMemory(
      UUID subChatId,
      UUID conversationId,
      String userId,
      StructuredSummary summary,
      Instant createdAt,
      Instant mergedAt) {
    Objects.requireNonNull(subChatId, "subChatId must not be null");
    Objects.requireNonNull(summary, "summary must not be null");
    if (!memoryIndex.isAvailable()) {
      log.debug("Memory index unavailable, sub-chat {} not stored", subChatId);
      increment(storeFailureCounter);
      return false;
    }
    MemoryDocument document =
        new MemoryDocument(
            conversationId,
            userId,
            summary.summary(),
            summary.keywords(),
            summary.actions(),
            summary.artifacts(),
            createdAt,
            mergedAt != null ? mergedAt : clock.instant());
    boolean stored = memoryIndex.upsert(subChatId, document);
    if (stored) {
      increment(storedCounter);
      log.info("Stored memory for sub-chat {} (user={})", subChatId, userId);
    } else {
      increment(storeFailureCounter);
      log.warn("Memory for sub-chat {} was not stored", subChatId);
    }
    return stored;
  }

  /** Searches all of the user's memories with the configured defaults. */
  public List<MemorySearchResult> searchMemories(String query, String userId, Integer topK) {
    return search(query, userId, topK, null);
  }

  /** Memories relevant to a query, excluding entries merged into the current conversation. */
  public List<MemorySearchResult> getRelevantMemories(
      String query, String userId, UUID currentConversationId, Integer topK) {
    return search(query, userId, topK, currentConversationId);
  }

  public void deleteMemory(UUID subChatId) {
    memoryIndex.delete(subChatId);
  }

  /**
   * Removes memories created more than {@code olderThanDays} days ago, keeping the newest {@code
   * maxEntries} of them when given. Without an age limit every entry of the user is considered.
   */
  public int cleanupUserMemories(String userId, Integer olderThanDays, Integer maxEntries) {
    Instant cutoff =
        olderThanDays != null
            ? clock.instant().minus(Duration.ofDays(Math.max(0, olderThanDays)))
            : null;
    return memoryIndex.cleanup(userId, cutoff, maxEntries);
  }

  public MemoryStats getUserMemoryStats(String userId) {
    return memoryIndex.stats(userId);
  }

  private List<MemorySearchResult> search(
      String query, String userId, Integer topK, UUID excludeConversationId) {
    if (!StringUtils.hasText(query) || !memoryIndex.isAvailable()) {
      return List.of();
    }
    int limit = topK != null && topK > 0 ? topK : properties.getTopK();
    MemorySearchOptions options =
        new MemorySearchOptions(limit, properties.getSimilarityThreshold(), excludeConversationId);
    List<MemorySearchResult> results = memoryIndex.search(query, userId, options);
    log.debug(
        "Memory search for user {} returned {} result(s) (vector={})",
        userId,
        results.size(),
        memoryIndex.supportsVectorSearch());
    return results;
  }

  private static void increment(Counter counter) {
    if (counter != null) {
      counter.increment();
    }
  }
}
