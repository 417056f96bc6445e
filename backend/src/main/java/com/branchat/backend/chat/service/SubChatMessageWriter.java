package com.branchat.backend.chat.service;

import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.SubChat;
import com.branchat.backend.chat.domain.SubChatMessage;
import com.branchat.backend.chat.persistence.SubChatMessageRepository;
import com.branchat.backend.chat.persistence.SubChatRepository;
import com.branchat.backend.common.exception.RequestValidationException;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends messages to a sub-conversation while holding its row lock, so sequence numbers stay
 * gap free and no message lands after the sub-conversation was resolved or cancelled.
 */
@Component
public class SubChatMessageWriter {

  private final SubChatRepository subChatRepository;
  private final SubChatMessageRepository subChatMessageRepository;

  public SubChatMessageWriter(
      SubChatRepository subChatRepository, SubChatMessageRepository subChatMessageRepository) {
    this.subChatRepository =
        Objects.requireNonNull(subChatRepository, "subChatRepository must not be null");
    this.subChatMessageRepository =
        Objects.requireNonNull(subChatMessageRepository, "subChatMessageRepository must not be null");
  }

  /**
   * @throws ResourceNotFoundException if the sub-conversation does not exist
   * @throws RequestValidationException if it is no longer active
   */
  @Transactional
  public SubChatMessage append(UUID subChatId, ChatRole role, String content) {
    SubChat subChat =
        subChatRepository
            .findByIdForUpdate(subChatId)
            .orElseThrow(() -> new ResourceNotFoundException("Sub-chat", subChatId));
    if (!subChat.isOpen()) {
      throw new RequestValidationException(
          "Cannot add messages to a resolved or cancelled sub-chat");
    }
    int nextSequence =
        subChatMessageRepository
                .findTopBySubChat_IdOrderBySequenceNumberDesc(subChatId)
                .map(SubChatMessage::getSequenceNumber)
                .orElse(0)
            + 1;
    SubChatMessage saved =
        subChatMessageRepository.save(new SubChatMessage(subChat, role, content, nextSequence));
    subChat.recordMessage();
    subChatRepository.save(subChat);
    return saved;
  }
}
