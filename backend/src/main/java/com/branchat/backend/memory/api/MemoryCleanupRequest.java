package com.branchat.backend.memory.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(
    description = "Selects which of the caller's memories to remove.",
    example =
        """
        {
          "olderThanDays": 90,
          "maxEntries": 50
        }
        """)
public record MemoryCleanupRequest(
    @Schema(description = "Only memories created more than this many days ago are considered.")
        @PositiveOrZero
        Integer olderThanDays,
    @Schema(description = "Number of the newest considered memories to keep; all are removed when empty.")
        @PositiveOrZero
        Integer maxEntries) {}
