package com.branchat.backend.chat.api;

import com.branchat.backend.chat.merge.MergeResult;
import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Resolved sub-chat and the summary injected into its parent conversation.")
public record MergeResponse(
    UUID subChatId,
    UUID conversationId,
    @Schema(example = "resolved") String status,
    Instant resolvedAt,
    StructuredSummary summary,
    @Schema(description = "The summary was derived from an unparseable model answer.")
        boolean summaryDegraded,
    InjectedMessage injectedMessage,
    UUID contextMarkerId,
    boolean memoryStored) {

  public static MergeResponse from(MergeResult result) {
    return new MergeResponse(
        result.subChatId(),
        result.conversationId(),
        result.status().name().toLowerCase(Locale.ROOT),
        result.resolvedAt(),
        result.summary(),
        result.summaryDegraded(),
        new InjectedMessage(
            result.injectedMessageId(), result.injectedContent(), result.injectedAt()),
        result.contextMarkerId(),
        result.memoryStored());
  }

  @Schema(description = "Assistant message appended to the parent conversation.")
  public record InjectedMessage(UUID id, String content, Instant createdAt) {}
}
