package com.branchat.backend.chat.embedding;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

@Schema(description = "Outcome of embedding the messages of a conversation that had no vector yet.")
public record BackfillResult(
    @Schema(description = "Conversation that was processed.") UUID conversationId,
    @Schema(description = "Messages without embedding found.", example = "23") int candidates,
    @Schema(description = "Messages embedded successfully.", example = "20") int embedded,
    @Schema(description = "Messages skipped because they are too short.", example = "2") int skipped,
    @Schema(description = "Messages whose embedding failed after retries.", example = "1") int failed,
    @Schema(description = "Number of processed batches.", example = "3") int batches) {}
