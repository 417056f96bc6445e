package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Stored sub-chat user message and the generated answer.")
public record SubChatTurnResponse(
    SubChatMessageResponse userMessage, SubChatMessageResponse assistantMessage) {}
