package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Query to assemble a context for, without generating an answer.")
public record ContextPreviewRequest(
    @Schema(description = "Query text.", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank
        String query,
    @Schema(description = "Context assembly overrides.") @Valid ContextRequestOptions context) {}
