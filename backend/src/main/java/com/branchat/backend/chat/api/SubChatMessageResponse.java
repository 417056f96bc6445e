package com.branchat.backend.chat.api;

import com.branchat.backend.chat.domain.SubChatMessage;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

public record SubChatMessageResponse(
    UUID id, String role, String content, int sequenceNumber, Instant createdAt) {

  public static SubChatMessageResponse from(SubChatMessage message) {
    return new SubChatMessageResponse(
        message.getId(),
        message.getRole().name().toLowerCase(Locale.ROOT),
        message.getContent(),
        message.getSequenceNumber(),
        message.getCreatedAt());
  }
}
