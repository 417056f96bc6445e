package com.branchat.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.generation")
public class ChatGenerationProperties {

  /** Model identifier reported in message metadata and usage records. */
  private String model = "gpt-4o-mini";

  /** Model identifier reported for embedding usage records. */
  private String embeddingModel = "text-embedding-3-small";

  private double temperature = 0.7;

  private int maxTokens = 2048;

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public String getEmbeddingModel() {
    return embeddingModel;
  }

  public void setEmbeddingModel(String embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

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
}
