package com.branchat.backend.chat.context;

import com.branchat.backend.chat.provider.model.PromptMessage;
import java.util.List;

public record AssembledContext(List<PromptMessage> orderedMessages, ContextMetadata metadata) {

  public AssembledContext {
    orderedMessages = orderedMessages != null ? List.copyOf(orderedMessages) : List.of();
  }
}
