package com.branchat.backend.chat.store;

import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import java.util.Objects;
import java.util.UUID;

/** Message to be appended to a conversation log. */
public record NewMessage(
    UUID conversationId,
    ChatRole role,
    String content,
    Integer tokens,
    String model,
    Long processingTimeMs,
    UUID sourceSubChatId,
    SubChatSummaryMarker summaryMarker) {

  public NewMessage {
    Objects.requireNonNull(conversationId, "conversationId must not be null");
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(content, "content must not be null");
  }

  public static NewMessage of(UUID conversationId, ChatRole role, String content) {
    return new NewMessage(conversationId, role, content, null, null, null, null, null);
  }

  public NewMessage withMetadata(Integer tokens, String model, Long processingTimeMs) {
    return new NewMessage(
        conversationId, role, content, tokens, model, processingTimeMs, sourceSubChatId, summaryMarker);
  }

  public NewMessage fromSubChat(UUID subChatId) {
    return new NewMessage(
        conversationId, role, content, tokens, model, processingTimeMs, subChatId, summaryMarker);
  }

  public NewMessage withSummaryMarker(SubChatSummaryMarker marker) {
    return new NewMessage(
        conversationId, role, content, tokens, model, processingTimeMs, sourceSubChatId, marker);
  }
}
