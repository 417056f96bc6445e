package com.branchat.backend.chat.config;

import com.branchat.backend.shared.vector.VectorStorage;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.embedding")
public class ChatEmbeddingProperties {

  /**
   * Enables background embedding of newly appended messages. When disabled, messages stay without
   * vectors and semantic context is served only after a manual backfill.
   */
  private boolean enabled = true;

  /** Messages shorter than this number of characters are not embedded. */
  private int minContentLength = 20;

  /** Number of worker threads computing embeddings. */
  private int concurrency = 2;

  /** Maximum number of embedding jobs waiting in the queue before new jobs are rejected. */
  private int queueSize = 500;

  /** Pause between two backfill batches of the same conversation. */
  private Duration backfillBatchDelay = Duration.ofSeconds(1);

  /** Upper bound of messages a single backfill run looks at. */
  private int backfillMaxMessages = 1000;

  private Retry retry = new Retry();

  private VectorStorage storage = new VectorStorage("chat_message_vectors");

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getMinContentLength() {
    return minContentLength;
  }

  public void setMinContentLength(int minContentLength) {
    this.minContentLength = minContentLength;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getQueueSize() {
    return queueSize;
  }

  public void setQueueSize(int queueSize) {
    this.queueSize = queueSize;
  }

  public Duration getBackfillBatchDelay() {
    return backfillBatchDelay;
  }

  public void setBackfillBatchDelay(Duration backfillBatchDelay) {
    this.backfillBatchDelay = backfillBatchDelay;
  }

  public int getBackfillMaxMessages() {
    return backfillMaxMessages;
  }

  public void setBackfillMaxMessages(int backfillMaxMessages) {
    this.backfillMaxMessages = backfillMaxMessages;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public VectorStorage getStorage() {
    return storage;
  }

  public void setStorage(VectorStorage storage) {
    this.storage = storage;
  }

  public static class Retry {

    /** Total number of attempts per embedding job, including the first one. */
    private int attempts = 3;

    private Duration initialDelay = Duration.ofMillis(250);

    /** Backoff multiplier. Values not greater than 1.0 switch to a fixed backoff. */
    private double multiplier = 2.0;

    private Duration maxDelay = Duration.ofSeconds(2);

    public int getAttempts() {
      return attempts;
    }

    public void setAttempts(int attempts) {
      this.attempts = attempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }
}
