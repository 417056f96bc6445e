package com.branchat.backend.chat.service;

import com.branchat.backend.chat.domain.ChatUser;
import com.branchat.backend.chat.persistence.ChatUserRepository;
import com.branchat.backend.common.exception.RequestValidationException;
import java.util.Objects;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Users are identified by the caller-supplied id and created on first use without memory opt-in. */
@Service
public class ChatUserService {

  private final ChatUserRepository chatUserRepository;

  public ChatUserService(ChatUserRepository chatUserRepository) {
    this.chatUserRepository =
        Objects.requireNonNull(chatUserRepository, "chatUserRepository must not be null");
  }

  @Transactional
  public ChatUser ensureUser(String userId) {
    if (!StringUtils.hasText(userId)) {
      throw new RequestValidationException("userId must not be blank");
    }
    return chatUserRepository
        .findById(userId)
        .orElseGet(() -> chatUserRepository.save(new ChatUser(userId, false)));
  }

  @Transactional(readOnly = true)
  public boolean isMemoryOptedIn(String userId) {
    return StringUtils.hasText(userId)
        && chatUserRepository.findById(userId).map(ChatUser::isMemoryOptIn).orElse(false);
  }

  @Transactional
  public ChatUser updateMemoryOptIn(String userId, boolean memoryOptIn) {
    ChatUser user = ensureUser(userId);
    user.setMemoryOptIn(memoryOptIn);
    return chatUserRepository.save(user);
  }
}
