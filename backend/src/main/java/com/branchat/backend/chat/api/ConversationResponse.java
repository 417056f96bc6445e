package com.branchat.backend.chat.api;

import com.branchat.backend.chat.domain.Conversation;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

@Schema(description = "Conversation summary.")
public record ConversationResponse(
    UUID id, String title, int messageCount, Instant lastMessageAt, Instant createdAt) {

  public static ConversationResponse from(Conversation conversation) {
    return new ConversationResponse(
        conversation.getId(),
        conversation.getTitle(),
        conversation.getMessageCount(),
        conversation.getLastMessageAt(),
        conversation.getCreatedAt());
  }
}
