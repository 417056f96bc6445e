package com.branchat.backend.chat.store;

import com.branchat.backend.chat.domain.ChatMessage;

public record ScoredMessage(ChatMessage message, double similarity) {}
