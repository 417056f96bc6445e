package com.branchat.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.merge")
public class ChatMergeProperties {

  /** Sampling temperature for the structured summary request. */
  private double temperature = 0.3;

  private int maxTokens = 1000;

  /** Number of characters of a raw model answer kept as summary when it is not valid JSON. */
  private int fallbackSummaryLength = 500;

  /** Maximum number of heuristic keywords extracted from an unparseable answer. */
  private int fallbackKeywordLimit = 10;

  /**
   * Appends a context marker with the merged summary to the parent conversation so that later
   * context assembly can render it in the sub-conversation tier.
   */
  private boolean recordContextMarker = true;

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public int getFallbackSummaryLength() {
    return fallbackSummaryLength;
  }

  public void setFallbackSummaryLength(int fallbackSummaryLength) {
    this.fallbackSummaryLength = fallbackSummaryLength;
  }

  public int getFallbackKeywordLimit() {
    return fallbackKeywordLimit;
  }

  public void setFallbackKeywordLimit(int fallbackKeywordLimit) {
    this.fallbackKeywordLimit = fallbackKeywordLimit;
  }

  public boolean isRecordContextMarker() {
    return recordContextMarker;
  }

  public void setRecordContextMarker(boolean recordContextMarker) {
    this.recordContextMarker = recordContextMarker;
  }
}
