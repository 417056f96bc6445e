package com.branchat.backend.chat.service;

import com.branchat.backend.chat.context.ContextOptions;
import com.branchat.backend.chat.provider.model.GenerationOptions;
import java.util.Objects;

/** A user turn: the message text, how to assemble context for it and how to sample the answer. */
public record TurnCommand(String content, ContextOptions contextOptions, GenerationOptions options) {

  public TurnCommand {
    Objects.requireNonNull(content, "content must not be null");
    options = options != null ? options : GenerationOptions.empty();
  }
}
