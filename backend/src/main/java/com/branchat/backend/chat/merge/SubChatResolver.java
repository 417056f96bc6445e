package com.branchat.backend.chat.merge;

import com.branchat.backend.chat.domain.SubChat;
import com.branchat.backend.chat.domain.SubChatStatus;
import com.branchat.backend.chat.persistence.SubChatRepository;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Moves a sub-conversation to RESOLVED after re-reading its status under a row lock. */
@Component
public class SubChatResolver {

  private final SubChatRepository subChatRepository;

  public SubChatResolver(SubChatRepository subChatRepository) {
    this.subChatRepository =
        Objects.requireNonNull(subChatRepository, "subChatRepository must not be null");
  }

  /**
   * @throws SubChatMergeRejectedException if a concurrent request already resolved or cancelled it
   */
  @Transactional
  public SubChat resolve(UUID subChatId, String summary, Instant resolvedAt) {
    SubChat subChat =
        subChatRepository
            .findByIdForUpdate(subChatId)
            .orElseThrow(() -> new ResourceNotFoundException("Sub-chat", subChatId));
    rejectUnlessOpen(subChat);
    subChat.resolve(summary, resolvedAt);
    subChatRepository.save(subChat);
    return subChat;
  }

  static void rejectUnlessOpen(SubChat subChat) {
    if (subChat.getStatus() == SubChatStatus.RESOLVED) {
      throw new SubChatMergeRejectedException(
          MergeRejection.SUBCHAT_ALREADY_RESOLVED, subChat.getId());
    }
    if (subChat.getStatus() == SubChatStatus.CANCELLED) {
      throw new SubChatMergeRejectedException(MergeRejection.SUBCHAT_CANCELLED, subChat.getId());
    }
  }
}
