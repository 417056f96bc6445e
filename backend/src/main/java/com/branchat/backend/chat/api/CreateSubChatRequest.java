package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(
    description = "Opens a side conversation branched from a parent conversation.",
    example =
        """
        {
          "title": "Check the migration order",
          "contextMessage": "We agreed to run the schema change before the backfill.",
          "includeInMemory": true
        }
        """)
public record CreateSubChatRequest(
    @Schema(description = "Sub-chat title; defaults to \"New Sub-chat\".") @Size(max = 256)
        String title,
    @Schema(description = "Excerpt of the parent conversation the sub-chat starts from.")
        String contextMessage,
    @Schema(description = "Store the merged summary in long-term memory.", defaultValue = "true")
        Boolean includeInMemory) {}
