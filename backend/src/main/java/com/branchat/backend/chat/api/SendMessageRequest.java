package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@Schema(
    description = "User message answered synchronously.",
    example =
        """
        {
          "content": "Which of the open risks did we already mitigate?",
          "context": { "enablePreviousKnowledge": true },
          "options": { "temperature": 0.4 }
        }
        """)
public record SendMessageRequest(
    @Schema(description = "Message text.", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank
        String content,
    @Schema(description = "Context assembly overrides.") @Valid ContextRequestOptions context,
    @Schema(description = "Sampling overrides.") @Valid GenerationRequestOptions options) {}
