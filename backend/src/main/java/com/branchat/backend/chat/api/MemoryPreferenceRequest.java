package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Long-term memory consent of the caller.")
public record MemoryPreferenceRequest(
    @Schema(description = "Allow merged summaries to be stored in memory.") @NotNull
        Boolean memoryOptIn) {}
