package com.branchat.backend.chat.stream;

import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Generation to relay to a connected client. The final assistant message is appended to {@code
 * conversationId}.
 */
public record StreamGenerationRequest(
    String clientId,
    UUID conversationId,
    String userId,
    List<PromptMessage> messages,
    GenerationOptions options) {

  public StreamGenerationRequest {
    Objects.requireNonNull(clientId, "clientId must not be null");
    Objects.requireNonNull(conversationId, "conversationId must not be null");
    messages = messages != null ? List.copyOf(messages) : List.of();
    options = options != null ? options : GenerationOptions.empty();
  }
}
