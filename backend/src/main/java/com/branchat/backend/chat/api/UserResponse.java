package com.branchat.backend.chat.api;

import com.branchat.backend.chat.domain.ChatUser;
import java.time.Instant;

public record UserResponse(String id, boolean memoryOptIn, Instant createdAt) {

  public static UserResponse from(ChatUser user) {
    return new UserResponse(user.getId(), user.isMemoryOptIn(), user.getCreatedAt());
  }
}
