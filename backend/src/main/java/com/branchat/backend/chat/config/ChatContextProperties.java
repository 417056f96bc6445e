package com.branchat.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.context")
public class ChatContextProperties {

  /** Number of latest messages that are always placed into the assembled context. */
  private int recentMessageCount = 10;

  /** Maximum number of semantically similar messages considered for the second tier. */
  private int semanticSearchResults = 5;

  /** Maximum number of merged sub-conversation summaries rendered into the context block. */
  private int subChatHistories = 5;

  /** Maximum number of other conversations of the same user used as previous knowledge. */
  private int previousConversations = 3;

  /** Default token budget for one assembled context. */
  private int maxTotalTokens = 8000;

  /** Minimum cosine similarity for a message to qualify as semantically related. */
  private double semanticThreshold = 0.7;

  /** Number of messages embedded per batch when backfilling a conversation. */
  private int embeddingBatchSize = 10;

  public int getRecentMessageCount() {
    return recentMessageCount;
  }

  public void setRecentMessageCount(int recentMessageCount) {
    this.recentMessageCount = recentMessageCount;
  }

  public int getSemanticSearchResults() {
    return semanticSearchResults;
  }

  public void setSemanticSearchResults(int semanticSearchResults) {
    this.semanticSearchResults = semanticSearchResults;
  }

  public int getSubChatHistories() {
    return subChatHistories;
  }

  public void setSubChatHistories(int subChatHistories) {
    this.subChatHistories = subChatHistories;
  }

  public int getPreviousConversations() {
    return previousConversations;
  }

  public void setPreviousConversations(int previousConversations) {
    this.previousConversations = previousConversations;
  }

  public int getMaxTotalTokens() {
    return maxTotalTokens;
  }

  public void setMaxTotalTokens(int maxTotalTokens) {
    this.maxTotalTokens = maxTotalTokens;
  }

  public double getSemanticThreshold() {
    return semanticThreshold;
  }

  public void setSemanticThreshold(double semanticThreshold) {
    this.semanticThreshold = semanticThreshold;
  }

  public int getEmbeddingBatchSize() {
    return embeddingBatchSize;
  }

  public void setEmbeddingBatchSize(int embeddingBatchSize) {
    this.embeddingBatchSize = embeddingBatchSize;
  }
}
