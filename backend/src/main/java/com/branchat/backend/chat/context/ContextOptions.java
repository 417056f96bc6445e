package com.branchat.backend.chat.context;

import com.branchat.backend.chat.config.ChatContextProperties;

/**
 * Per-call switches for context assembly.
 *
 * @param recentMessageCount number of latest messages that are always included
 * @param enableSemantic include messages similar to the query text
 * @param enableSubchatSummaries include merged sub-conversation summaries
 * @param enablePreviousKnowledge include excerpts of the user's other conversations
 * @param enableDocuments reserved for document excerpts; no document source is wired
 * @param maxTokens token budget of the assembled context
 */
public record ContextOptions(
    int recentMessageCount,
    boolean enableSemantic,
    boolean enableSubchatSummaries,
    boolean enablePreviousKnowledge,
    boolean enableDocuments,
    int maxTokens) {

  public static final int DEFAULT_RECENT_MESSAGE_COUNT = 10;
  public static final int DEFAULT_MAX_TOKENS = 8000;

  public ContextOptions {
    recentMessageCount = Math.max(recentMessageCount, 0);
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
  }

  public static ContextOptions defaults() {
    return new ContextOptions(DEFAULT_RECENT_MESSAGE_COUNT, true, true, false, false, DEFAULT_MAX_TOKENS);
  }

  public static ContextOptions defaults(ChatContextProperties properties) {
    return new ContextOptions(
        properties.getRecentMessageCount(), true, true, false, false, properties.getMaxTotalTokens());
  }

  public ContextOptions withMaxTokens(int value) {
    return new ContextOptions(
        recentMessageCount,
        enableSemantic,
        enableSubchatSummaries,
        enablePreviousKnowledge,
        enableDocuments,
        value);
  }

  public ContextOptions withPreviousKnowledge(boolean value) {
    return new ContextOptions(
        recentMessageCount, enableSemantic, enableSubchatSummaries, value, enableDocuments, maxTokens);
  }
}
