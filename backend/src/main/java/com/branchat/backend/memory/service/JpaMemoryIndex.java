package com.branchat.backend.memory.service;

import com.branchat.backend.chat.provider.GenerationUnavailableException;
import com.branchat.backend.memory.config.MemoryProperties;
import com.branchat.backend.memory.config.MemoryVectorStoreConfiguration;
import com.branchat.backend.memory.domain.MemoryEntry;
import com.branchat.backend.memory.model.MemoryDocument;
import com.branchat.backend.memory.model.MemorySearchOptions;
import com.branchat.backend.memory.model.MemorySearchResult;
import com.branchat.backend.memory.model.MemoryStats;
import com.branchat.backend.memory.persistence.MemoryEntryRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

/**
 * Memory index over the {@code memory_entry} table and the memory vector store. Entries are the
 * source of truth; the vector store holds one document per entry under the same id, filtered by
 * {@code user_id} and {@code conversation_id} metadata. Store failures mark the index unavailable
 * until {@link MemoryProperties#getRetryUnavailableAfter()} elapses.
 */
@Slf4j
@Service
public class JpaMemoryIndex implements MemoryIndex {

  static final String USER_ID_KEY = "user_id";
  static final String CONVERSATION_ID_KEY = "conversation_id";

  private final MemoryEntryRepository repository;
  private final VectorStore vectorStore;
  private final MemoryProperties properties;
  private final Clock clock;
  private final AtomicReference<Instant> unavailableSince = new AtomicReference<>();

  @Autowired
  public JpaMemoryIndex(
      MemoryEntryRepository repository,
      @Qualifier(MemoryVectorStoreConfiguration.MEMORY_VECTOR_STORE) VectorStore vectorStore,
      MemoryProperties properties) {
    this(repository, vectorStore, properties, Clock.systemUTC());
  }

  JpaMemoryIndex(
      MemoryEntryRepository repository,
      VectorStore vectorStore,
      MemoryProperties properties,
      Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository must not be null");
    this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public boolean upsert(UUID id, MemoryDocument document) {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(document, "document must not be null");
    if (!isAvailable()) {
      log.debug("Memory index unavailable, skipping upsert of {}", id);
      return false;
    }
    Instant now = clock.instant();
    MemoryEntry entry =
        new MemoryEntry(
            id,
            document.conversationId(),
            document.userId(),
            document.summary(),
            document.keywords(),
            document.actions(),
            document.artifacts(),
            document.createdAt() != null ? document.createdAt() : now,
            document.mergedAt() != null ? document.mergedAt() : now);
    try {
      entry.setVectorIndexed(properties.isVectorSearchEnabled() && writeVector(id, document));
      repository.save(entry);
      markAvailable();
      log.debug(
          "Stored memory {} for user {} (vector={})",
          id,
          document.userId(),
          entry.isVectorIndexed());
      return true;
    } catch (DataAccessException | TransactionException ex) {
      markUnavailable("upsert", ex);
      return false;
    }
  }

  @Override
  public List<MemorySearchResult> search(
      String query, String userId, MemorySearchOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    if (!StringUtils.hasText(userId)
        || !StringUtils.hasText(query)
        || options.topK() == 0
        || !isAvailable()) {
      return List.of();
    }
    try {
      List<MemorySearchResult> results =
          supportsVectorSearch()
              ? searchByVector(query, userId, options)
              : rankLexically(loadEntries(userId, options.excludeConversationId()), query, options.topK());
      markAvailable();
      return results;
    } catch (DataAccessException | TransactionException ex) {
      markUnavailable("search", ex);
      return List.of();
    }
  }

  @Override
  public void delete(UUID id) {
    if (id == null || !isAvailable()) {
      return;
    }
    try {
      vectorStore.delete(List.of(id.toString()));
      repository.findById(id).ifPresent(repository::delete);
      markAvailable();
    } catch (DataAccessException | TransactionException ex) {
      markUnavailable("delete", ex);
    }
  }

  @Override
  public int cleanup(String userId, Instant createdBefore, Integer keepNewest) {
    if (!StringUtils.hasText(userId) || !isAvailable()) {
      return 0;
    }
    try {
      List<MemoryEntry> matches =
          createdBefore != null
              ? repository.findByUserIdAndCreatedAtBeforeOrderByCreatedAtDesc(userId, createdBefore)
              : repository.findByUserIdOrderByCreatedAtDesc(userId);
      List<MemoryEntry> doomed =
          keepNewest != null
              ? matches.stream().skip(Math.max(0, keepNewest)).toList()
              : matches;
      if (!doomed.isEmpty()) {
        vectorStore.delete(doomed.stream().map(entry -> entry.getId().toString()).toList());
        repository.deleteAll(doomed);
      }
      markAvailable();
      log.info("Removed {} memories for user {}", doomed.size(), userId);
      return doomed.size();
    } catch (DataAccessException | TransactionException ex) {
      markUnavailable("cleanup", ex);
      return 0;
    }
  }

  @Override
  public MemoryStats stats(String userId) {
    if (!StringUtils.hasText(userId) || !isAvailable()) {
      return MemoryStats.unavailable();
    }
    try {
      List<MemoryEntry> entries = repository.findByUserIdOrderByCreatedAtDesc(userId);
      markAvailable();
      if (entries.isEmpty()) {
        return new MemoryStats(0, null, null, 0.0d, true, supportsVectorSearch());
      }
      double averageKeywords =
          entries.stream().mapToInt(entry -> entry.getKeywords().size()).average().orElse(0.0d);
      return new MemoryStats(
          entries.size(),
          entries.get(entries.size() - 1).getCreatedAt(),
          entries.get(0).getCreatedAt(),
          averageKeywords,
          true,
          supportsVectorSearch());
    } catch (DataAccessException | TransactionException ex) {
      markUnavailable("stats", ex);
      return MemoryStats.unavailable();
    }
  }

  @Override
  public boolean isAvailable() {
    if (!properties.isEnabled()) {
      return false;
    }
    Instant since = unavailableSince.get();
    if (since == null) {
      return true;
    }
    return !clock.instant().isBefore(since.plus(properties.getRetryUnavailableAfter()));
  }

  @Override
  public boolean supportsVectorSearch() {
    return properties.isVectorSearchEnabled() && isAvailable();
  }

  private boolean writeVector(UUID id, MemoryDocument document) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(USER_ID_KEY, document.userId());
    metadata.put(CONVERSATION_ID_KEY, document.conversationId().toString());
    Document vectorDocument =
        Document.builder().id(id.toString()).text(document.embeddingText()).metadata(metadata).build();
    vectorStore.delete(List.of(id.toString()));
    try {
      vectorStore.add(List.of(vectorDocument));
      return true;
    } catch (GenerationUnavailableException ex) {
      log.warn("Memory {} stored without vector: {}", id, ex.getMessage());
      return false;
    }
  }

  /**
   * Vector hits ranked by cosine similarity, followed by lexical matches among entries that have no
   * vector. Falls back to lexical ranking of all entries when the query cannot be embedded.
   */
  private List<MemorySearchResult> searchByVector(
      String query, String userId, MemorySearchOptions options) {
    SearchRequest request =
        SearchRequest.builder()
            .query(query)
            .topK(options.topK())
            .similarityThreshold(options.threshold())
            .filterExpression(buildFilter(userId, options.excludeConversationId()))
            .build();
    List<Document> documents;
    try {
      documents = vectorStore.similaritySearch(request);
    } catch (GenerationUnavailableException ex) {
      log.warn("Query embedding unavailable, ranking memories lexically: {}", ex.getMessage());
      return rankLexically(loadEntries(userId, options.excludeConversationId()), query, options.topK());
    }

    List<MemorySearchResult> results = new ArrayList<>(joinEntries(documents));
    if (results.size() < options.topK()) {
      Set<UUID> seen =
          results.stream()
              .map(MemorySearchResult::subChatId)
              .collect(Collectors.toCollection(LinkedHashSet::new));
      List<MemoryEntry> withoutVector =
          repository.findByUserIdAndVectorIndexedFalseOrderByMergedAtDesc(userId).stream()
              .filter(entry -> !seen.contains(entry.getId()))
              .filter(
                  entry ->
                      options.excludeConversationId() == null
                          || !options.excludeConversationId().equals(entry.getConversationId()))
              .toList();
      results.addAll(rankLexically(withoutVector, query, options.topK() - results.size()));
    }
    return results;
  }

  private List<MemorySearchResult> joinEntries(List<Document> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }
    List<UUID> ids = documents.stream().map(document -> UUID.fromString(document.getId())).toList();
    Map<UUID, MemoryEntry> entriesById =
        repository.findAllById(ids).stream()
            .collect(Collectors.toMap(MemoryEntry::getId, Function.identity()));
    List<MemorySearchResult> results = new ArrayList<>(documents.size());
    for (Document document : documents) {
      MemoryEntry entry = entriesById.get(UUID.fromString(document.getId()));
      if (entry == null) {
        log.debug("Vector {} has no memory entry, skipping", document.getId());
        continue;
      }
      results.add(toResult(entry, document.getScore() != null ? document.getScore() : 0.0d));
    }
    results.sort(Comparator.comparingDouble(MemorySearchResult::score).reversed());
    return results;
  }

  private static Filter.Expression buildFilter(String userId, UUID excludeConversationId) {
    FilterExpressionBuilder builder = new FilterExpressionBuilder();
    if (excludeConversationId == null) {
      return builder.eq(USER_ID_KEY, userId).build();
    }
    return builder
        .and(
            builder.eq(USER_ID_KEY, userId),
            builder.ne(CONVERSATION_ID_KEY, excludeConversationId.toString()))
        .build();
  }

  private List<MemoryEntry> loadEntries(String userId, UUID excludeConversationId) {
    return excludeConversationId != null
        ? repository.findByUserIdAndConversationIdNotOrderByMergedAtDesc(userId, excludeConversationId)
        : repository.findByUserIdOrderByMergedAtDesc(userId);
  }

  private List<MemorySearchResult> rankLexically(List<MemoryEntry> entries, String query, int topK) {
    if (topK <= 0) {
      return List.of();
    }
    return entries.stream()
        .map(
            entry ->
                toResult(entry, LexicalScorer.score(query, entry.getSummary(), entry.getKeywords())))
        .filter(result -> result.score() > 0.0d)
        .sorted(Comparator.comparingDouble(MemorySearchResult::score).reversed())
        .limit(topK)
        .toList();
  }

  private MemorySearchResult toResult(MemoryEntry entry, double score) {
    return new MemorySearchResult(
        entry.getId(),
        entry.getConversationId(),
        score,
        entry.getSummary(),
        entry.getKeywords(),
        entry.getActions(),
        entry.getArtifacts(),
        entry.getCreatedAt(),
        entry.getMergedAt());
  }

  private void markAvailable() {
    if (unavailableSince.getAndSet(null) != null) {
      log.info("Memory store reachable again");
    }
  }

  private void markUnavailable(String operation, RuntimeException ex) {
    unavailableSince.set(clock.instant());
    log.warn("Memory store {} failed, marking index unavailable: {}", operation, ex.getMessage());
    log.debug("Memory store failure detail", ex);
  }
}
