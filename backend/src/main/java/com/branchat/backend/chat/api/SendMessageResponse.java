package com.branchat.backend.chat.api;

import com.branchat.backend.chat.context.ContextMetadata;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Stored user message, the generated answer and how its context was built.")
public record SendMessageResponse(
    MessageResponse userMessage, MessageResponse assistantMessage, ContextMetadata context) {}
