package com.branchat.backend.chat.persistence;

import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  List<ChatMessage> findByConversation_IdOrderBySequenceNumberDesc(
      UUID conversationId, Pageable pageable);

  Optional<ChatMessage> findTopByConversation_IdOrderBySequenceNumberDesc(UUID conversationId);

  List<ChatMessage> findByConversation_IdAndSummaryMarkerIsNotNullOrderBySequenceNumberDesc(
      UUID conversationId, Pageable pageable);

  List<ChatMessage> findByConversation_IdAndVectorIndexedFalseAndRoleNotOrderBySequenceNumberAsc(
      UUID conversationId, ChatRole excludedRole, Pageable pageable);
}
