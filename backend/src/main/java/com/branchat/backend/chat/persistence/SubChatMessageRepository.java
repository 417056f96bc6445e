package com.branchat.backend.chat.persistence;

import com.branchat.backend.chat.domain.SubChatMessage;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SubChatMessageRepository extends JpaRepository<SubChatMessage, UUID> {

  List<SubChatMessage> findBySubChat_IdOrderBySequenceNumberAsc(UUID subChatId);

  List<SubChatMessage> findBySubChat_IdOrderBySequenceNumberDesc(UUID subChatId, Pageable pageable);

  Optional<SubChatMessage> findTopBySubChat_IdOrderBySequenceNumberDesc(UUID subChatId);
}
