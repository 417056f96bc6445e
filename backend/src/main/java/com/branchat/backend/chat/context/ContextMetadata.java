package com.branchat.backend.chat.context;

public record ContextMetadata(
    int recentMessageCount,
    int semanticMessageCount,
    int subChatCount,
    int previousConversationCount,
    int estimatedTokens,
    int maxTokens,
    boolean truncated) {}
