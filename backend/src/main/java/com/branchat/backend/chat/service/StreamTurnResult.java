package com.branchat.backend.chat.service;

import com.branchat.backend.chat.context.ContextMetadata;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.stream.StreamSession;

public record StreamTurnResult(
    ChatMessage userMessage, StreamSession session, ContextMetadata context) {}
