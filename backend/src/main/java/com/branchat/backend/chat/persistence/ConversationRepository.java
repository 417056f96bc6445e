package com.branchat.backend.chat.persistence;

import com.branchat.backend.chat.domain.Conversation;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  List<Conversation> findByUserIdAndIdNotOrderByUpdatedAtDesc(
      String userId, UUID excludedId, Pageable pageable);

  /** Serialises appends to one conversation until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select c from Conversation c where c.id = :id")
  Optional<Conversation> findByIdForUpdate(@Param("id") UUID id);
}
