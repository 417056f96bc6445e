package com.branchat.backend.chat.api;

import com.branchat.backend.chat.domain.SubChat;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Sub-chat state.")
public record SubChatResponse(
    UUID id,
    UUID conversationId,
    String title,
    String contextMessage,
    @Schema(description = "Lifecycle state.", example = "active") String status,
    boolean includeInMemory,
    int messageCount,
    String summary,
    Instant resolvedAt,
    Instant createdAt) {

  public static SubChatResponse from(SubChat subChat) {
    return new SubChatResponse(
        subChat.getId(),
        subChat.getParentConversation().getId(),
        subChat.getTitle(),
        subChat.getContextMessage(),
        subChat.getStatus().name().toLowerCase(Locale.ROOT),
        subChat.isIncludeInMemory(),
        subChat.getMessageCount(),
        subChat.getSummary(),
        subChat.getResolvedAt(),
        subChat.getCreatedAt());
  }
}
