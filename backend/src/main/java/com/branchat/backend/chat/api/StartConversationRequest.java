package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(
    description = "Starts a conversation, optionally seeded with notes from long-term memory.",
    example =
        """
        {
          "title": "Release planning",
          "useMemory": true,
          "initialMessage": "Let's continue with the rollout checklist."
        }
        """)
public record StartConversationRequest(
    @Schema(description = "Conversation title; derived from the initial message when empty.")
        @Size(max = 256)
        String title,
    @Schema(description = "Seed the conversation with relevant memories of the caller.")
        Boolean useMemory,
    @Schema(description = "First user message.") String initialMessage) {}
