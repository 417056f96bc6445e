package com.branchat.backend.chat.store;

import com.branchat.backend.chat.domain.ChatRole;
import java.util.UUID;

public record MessageAppendedEvent(
    UUID conversationId, UUID messageId, ChatRole role, int contentLength) {}
