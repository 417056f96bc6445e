package com.branchat.backend.memory.config;

import com.branchat.backend.shared.vector.VectorStorage;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.memory")
public class MemoryProperties {

  /** Master switch for long-term memory. A disabled index reports itself as unavailable. */
  private boolean enabled = true;

  /**
   * Enables cosine ranking through the memory vector store. When disabled, searches always use
   * lexical scoring over summaries and keywords.
   */
  private boolean vectorSearchEnabled = true;

  private int topK = 5;

  private double similarityThreshold = 0.7;

  private VectorStorage storage = new VectorStorage("memory_vectors");

  /** How long the index stays marked unavailable after a store failure before it is tried again. */
  private Duration retryUnavailableAfter = Duration.ofSeconds(30);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isVectorSearchEnabled() {
    return vectorSearchEnabled;
  }

  public void setVectorSearchEnabled(boolean vectorSearchEnabled) {
    this.vectorSearchEnabled = vectorSearchEnabled;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public VectorStorage getStorage() {
    return storage;
  }

  public void setStorage(VectorStorage storage) {
    this.storage = storage;
  }

  public Duration getRetryUnavailableAfter() {
    return retryUnavailableAfter;
  }

  public void setRetryUnavailableAfter(Duration retryUnavailableAfter) {
    this.retryUnavailableAfter = retryUnavailableAfter;
  }
}
