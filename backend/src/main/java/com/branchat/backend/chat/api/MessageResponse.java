package com.branchat.backend.chat.api;

import com.branchat.backend.chat.domain.ChatMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored conversation message.")
public record MessageResponse(
    UUID id,
    @Schema(description = "Message role.", example = "assistant") String role,
    String content,
    @Schema(description = "Estimated tokens of the content.") Integer tokens,
    @Schema(description = "Model that produced the message.") String model,
    @Schema(description = "Generation time in milliseconds.") Long processingTimeMs,
    @Schema(description = "Sub-chat the message was injected from.") UUID sourceSubChatId,
    Instant createdAt) {

  public static MessageResponse from(ChatMessage message) {
    if (message == null) {
      return null;
    }
    return new MessageResponse(
        message.getId(),
        message.getRole().name().toLowerCase(Locale.ROOT),
        message.getContent(),
        message.getTokens(),
        message.getModel(),
        message.getProcessingTimeMs(),
        message.getSourceSubChatId(),
        message.getCreatedAt());
  }
}
