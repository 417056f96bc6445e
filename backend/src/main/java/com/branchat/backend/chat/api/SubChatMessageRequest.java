package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "User message inside a sub-chat.")
public record SubChatMessageRequest(
    @Schema(description = "Message text.", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank
        String content,
    @Schema(description = "Sampling overrides.") @Valid GenerationRequestOptions options) {}
