package com.branchat.backend.memory.persistence;

import com.branchat.backend.memory.domain.MemoryEntry;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MemoryEntryRepository extends JpaRepository<MemoryEntry, UUID> {

  List<MemoryEntry> findByUserIdOrderByMergedAtDesc(String userId);

  List<MemoryEntry> findByUserIdAndConversationIdNotOrderByMergedAtDesc(
      String userId, UUID excludedConversationId);

  /** Entries kept for lexical search only because their vector could not be written. */
  List<MemoryEntry> findByUserIdAndVectorIndexedFalseOrderByMergedAtDesc(String userId);

  List<MemoryEntry> findByUserIdOrderByCreatedAtDesc(String userId);

  List<MemoryEntry> findByUserIdAndCreatedAtBeforeOrderByCreatedAtDesc(String userId, Instant cutoff);
}
