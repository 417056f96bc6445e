package com.branchat.backend.chat.embedding;

import com.branchat.backend.chat.config.ChatContextProperties;
import com.branchat.backend.chat.config.ChatEmbeddingProperties;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.provider.GenerationUnavailableException;
import com.branchat.backend.chat.store.MessageAppendedEvent;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Computes message embeddings off the request path. Appended messages are queued once their
 * transaction commits; each job retries the embedding call with exponential backoff and records
 * failures instead of dropping them silently.
 */
@Slf4j
@Service
public class MessageEmbeddingQueue {

  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

  private final MessageStore messageStore;
  private final ChatEmbeddingProperties properties;
  private final ChatContextProperties contextProperties;
  private final RetryTemplate retryTemplate;
  private final Semaphore concurrencyLimiter;
  private final ThreadPoolExecutor executor;
  private final Counter embeddedCounter;
  private final Counter failureCounter;
  private final Counter rejectedCounter;

  public MessageEmbeddingQueue(
      MessageStore messageStore,
      ChatEmbeddingProperties properties,
      ChatContextProperties contextProperties,
      MeterRegistry meterRegistry) {
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.contextProperties =
        Objects.requireNonNull(contextProperties, "contextProperties must not be null");
    this.retryTemplate = buildRetryTemplate(properties.getRetry());

    int concurrency = Math.max(1, properties.getConcurrency());
    int queueSize = Math.max(concurrency, properties.getQueueSize());
    this.concurrencyLimiter = new Semaphore(concurrency, true);
    this.executor = buildExecutor(concurrency, queueSize);

    if (meterRegistry != null) {
      this.embeddedCounter =
          Counter.builder("chat_embedding_jobs_total")
              .description("Number of messages embedded in the background")
              .register(meterRegistry);
      this.failureCounter =
          Counter.builder("chat_embedding_failures_total")
              .description("Number of embedding jobs that failed after retries")
              .register(meterRegistry);
      this.rejectedCounter =
          Counter.builder("chat_embedding_queue_rejections_total")
              .description("Number of embedding jobs dropped due to a full queue")
              .register(meterRegistry);
      Gauge.builder("chat_embedding_queue_size", executor, exec -> exec.getQueue().size())
          .description("Number of embedding jobs waiting in queue")
          .register(meterRegistry);
    } else {
      this.embeddedCounter = null;
      this.failureCounter = null;
      this.rejectedCounter = null;
    }
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onMessageAppended(MessageAppendedEvent event) {
    if (!properties.isEnabled() || !isEmbeddable(event.role(), event.contentLength())) {
      return;
    }
    enqueue(event.messageId());
  }

  /** Queues an embedding job; returns {@code false} when the queue is full. */
  public boolean enqueue(UUID messageId) {
    Objects.requireNonNull(messageId, "messageId must not be null");
    try {
      executor.execute(() -> runJob(messageId));
      return true;
    } catch (RejectedExecutionException rejectedExecutionException) {
      increment(rejectedCounter);
      log.warn("Embedding queue full, message {} left without embedding", messageId);
      return false;
    }
  }

  /**
   * Embeds every message of the conversation that has no vector yet, in batches with a pause
   * between batches. Runs on the calling thread.
   */
  public BackfillResult backfill(UUID conversationId) {
    if (messageStore.findConversation(conversationId).isEmpty()) {
      throw new ResourceNotFoundException("Conversation", conversationId);
    }
    List<ChatMessage> candidates =
        messageStore.findWithoutEmbedding(
            conversationId, Math.max(1, properties.getBackfillMaxMessages()));
    List<ChatMessage> eligible =
        candidates.stream()
            .filter(message -> isEmbeddable(message.getRole(), contentLength(message)))
            .toList();
    int batchSize = Math.max(1, contextProperties.getEmbeddingBatchSize());
    int embedded = 0;
    int failed = 0;
    int batches = 0;
    for (int start = 0; start < eligible.size(); start += batchSize) {
      if (batches > 0 && !pauseBetweenBatches()) {
        log.warn(
            "Backfill of conversation {} interrupted after {} batch(es)", conversationId, batches);
        break;
      }
      List<ChatMessage> batch = eligible.subList(start, Math.min(start + batchSize, eligible.size()));
      for (ChatMessage message : batch) {
        try {
          embed(message);
          embedded++;
        } catch (RuntimeException ex) {
          failed++;
          increment(failureCounter);
          log.warn("Backfill embedding failed for message {}: {}", message.getId(), ex.getMessage());
        }
      }
      batches++;
    }
    BackfillResult result =
        new BackfillResult(
            conversationId,
            candidates.size(),
            embedded,
            candidates.size() - eligible.size(),
            failed,
            batches);
    log.info("Embedding backfill finished: {}", result);
    return result;
  }

  /**
   * Embeds a single stored message unless it already has a vector.
   *
   * @return {@code true} when a vector was written
   */
  boolean embedMessage(UUID messageId) {
    Optional<ChatMessage> message = messageStore.findMessage(messageId);
    if (message.isEmpty()) {
      log.debug("Message {} disappeared before it could be embedded", messageId);
      return false;
    }
    if (message.get().isVectorIndexed()) {
      return false;
    }
    embed(message.get());
    return true;
  }

  private void embed(ChatMessage message) {
    retryTemplate.execute(
        context -> {
          messageStore.indexEmbedding(message.getId());
          return null;
        });
    increment(embeddedCounter);
  }

  private void runJob(UUID messageId) {
    concurrencyLimiter.acquireUninterruptibly();
    try {
      if (embedMessage(messageId) && log.isDebugEnabled()) {
        log.debug("Embedded message {}", messageId);
      }
    } catch (Exception exception) {
      increment(failureCounter);
      log.warn("Embedding job for message {} failed: {}", messageId, exception.getMessage());
    } finally {
      concurrencyLimiter.release();
    }
  }

  private boolean isEmbeddable(ChatRole role, int contentLength) {
    return role != ChatRole.SYSTEM && contentLength >= properties.getMinContentLength();
  }

  private boolean pauseBetweenBatches() {
    Duration delay = properties.getBackfillBatchDelay();
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static int contentLength(ChatMessage message) {
    return message.getContent() != null ? message.getContent().length() : 0;
  }

  private static RetryTemplate buildRetryTemplate(ChatEmbeddingProperties.Retry retry) {
    int attempts = retry != null ? Math.max(1, retry.getAttempts()) : 3;
    long initialInterval =
        retry != null && retry.getInitialDelay() != null
            ? Math.max(1L, retry.getInitialDelay().toMillis())
            : 250L;
    double multiplier = retry != null && retry.getMultiplier() > 1.0 ? retry.getMultiplier() : 2.0;
    long maxInterval =
        retry != null && retry.getMaxDelay() != null
            ? Math.max(initialInterval, retry.getMaxDelay().toMillis())
            : initialInterval * 8;
    return RetryTemplate.builder()
        .maxAttempts(attempts)
        .exponentialBackoff(initialInterval, multiplier, maxInterval)
        .retryOn(GenerationUnavailableException.class)
        .build();
  }

  private ThreadPoolExecutor buildExecutor(int concurrency, int queueSize) {
    BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(queueSize, true);
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("chat-embedding-" + WORKER_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS, queue, factory);
  }

  private static void increment(Counter counter) {
    if (counter != null) {
      counter.increment();
    }
  }
}
