package com.branchat.backend.chat.provider.model;

import com.branchat.backend.chat.domain.ChatRole;
import java.util.Objects;

public record PromptMessage(ChatRole role, String content) {

  public PromptMessage {
    Objects.requireNonNull(role, "role must not be null");
    content = content != null ? content : "";
  }

  public static PromptMessage user(String content) {
    return new PromptMessage(ChatRole.USER, content);
  }

  public static PromptMessage assistant(String content) {
    return new PromptMessage(ChatRole.ASSISTANT, content);
  }

  public static PromptMessage system(String content) {
    return new PromptMessage(ChatRole.SYSTEM, content);
  }
}
