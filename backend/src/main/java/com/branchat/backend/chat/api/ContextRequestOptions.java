package com.branchat.backend.chat.api;

import com.branchat.backend.chat.context.ContextOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

@Schema(description = "Overrides for context assembly; unset fields keep the configured defaults.")
public record ContextRequestOptions(
    @Schema(description = "Number of latest messages always included.", example = "10")
        @Min(0)
        @Max(100)
        Integer recentMessageCount,
    @Schema(description = "Include messages similar to the query.") Boolean enableSemantic,
    @Schema(description = "Include merged sub-chat summaries.") Boolean enableSubchatSummaries,
    @Schema(description = "Include excerpts of the caller's other conversations.")
        Boolean enablePreviousKnowledge,
    @Schema(description = "Include document excerpts.") Boolean enableDocuments,
    @Schema(description = "Token budget of the assembled context.", example = "8000") @Positive
        Integer maxTokens) {

  /** Applies the non-null fields of {@code overrides} on top of {@code defaults}. */
  public static ContextOptions merge(ContextRequestOptions overrides, ContextOptions defaults) {
    if (overrides == null) {
      return defaults;
    }
    return new ContextOptions(
        overrides.recentMessageCount() != null
            ? overrides.recentMessageCount()
            : defaults.recentMessageCount(),
        overrides.enableSemantic() != null ? overrides.enableSemantic() : defaults.enableSemantic(),
        overrides.enableSubchatSummaries() != null
            ? overrides.enableSubchatSummaries()
            : defaults.enableSubchatSummaries(),
        overrides.enablePreviousKnowledge() != null
            ? overrides.enablePreviousKnowledge()
            : defaults.enablePreviousKnowledge(),
        overrides.enableDocuments() != null ? overrides.enableDocuments() : defaults.enableDocuments(),
        overrides.maxTokens() != null ? overrides.maxTokens() : defaults.maxTokens());
  }
}
