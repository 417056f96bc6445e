package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "User message answered over the client's event stream.")
public record StreamMessageRequest(
    @Schema(
            description = "Client id used when connecting to /api/stream/connect.",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String clientId,
    @Schema(description = "Message text.", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank
        String content,
    @Schema(description = "Context assembly overrides.") @Valid ContextRequestOptions context,
    @Schema(description = "Sampling overrides.") @Valid GenerationRequestOptions options) {}
