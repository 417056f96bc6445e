package com.branchat.backend.memory.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a memory cleanup.")
public record MemoryCleanupResponse(
    @Schema(description = "Number of removed memories.", example = "12") int deleted) {}
