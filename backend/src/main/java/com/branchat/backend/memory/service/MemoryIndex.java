package com.branchat.backend.memory.service;

import com.branchat.backend.memory.model.MemoryDocument;
import com.branchat.backend.memory.model.MemorySearchOptions;
import com.branchat.backend.memory.model.MemorySearchResult;
import com.branchat.backend.memory.model.MemoryStats;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable store of merged sub-conversation summaries, one entry per sub-conversation id.
 *
 * <p>Implementations never throw because the backing store is unreachable: writes report {@code
 * false}, reads return empty results.
 */
public interface MemoryIndex {

  /**
   * Inserts or overwrites the entry with the given id and writes its vector. When the vector cannot
   * be computed the entry is still stored and stays reachable through lexical search.
   */
  boolean upsert(UUID id, MemoryDocument document);

  /**
   * Ranks the user's entries by cosine similarity when vectors are supported and the query can be
   * embedded, otherwise by fuzzy lexical matching over summary and keywords.
   */
  List<MemorySearchResult> search(String query, String userId, MemorySearchOptions options);

  /** Removes an entry. A missing entry is not an error. */
  void delete(UUID id);

  /**
   * Deletes the user's entries created before {@code createdBefore} (all entries when {@code null})
   * beyond the newest {@code keepNewest} ones ({@code null} keeps none of them).
   *
   * @return number of deleted entries
   */
  int cleanup(String userId, Instant createdBefore, Integer keepNewest);

  MemoryStats stats(String userId);

  boolean isAvailable();

  boolean supportsVectorSearch();
}
