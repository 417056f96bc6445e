package com.branchat.backend.chat.service;

import com.branchat.backend.chat.context.ContextMetadata;
import com.branchat.backend.chat.domain.ChatMessage;

public record TurnResult(
    ChatMessage userMessage, ChatMessage assistantMessage, ContextMetadata context) {}
