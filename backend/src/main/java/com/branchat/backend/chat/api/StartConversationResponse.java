package com.branchat.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Newly started conversation.")
public record StartConversationResponse(
    ConversationResponse conversation,
    @Schema(description = "Identifier of the stored initial message.") UUID userMessageId,
    @Schema(description = "Number of memories written as a leading note.", example = "2")
        int memoriesUsed) {}
