package com.branchat.backend.chat.token;

import com.branchat.backend.chat.config.ChatUsageProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory log of token usage. The oldest records are evicted once the configured capacity
 * is reached. All access goes through this instance and is serialised on its monitor.
 */
@Component
public class TokenUsageLog {

  private static final Logger log = LoggerFactory.getLogger(TokenUsageLog.class);
  private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1_000);
  private static final BigDecimal HALF = new BigDecimal("0.5");
  private static final int COST_SCALE = 8;

  private final ChatUsageProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final int capacity;
  private final Deque<UsageRecord> entries = new ArrayDeque<>();

  @Autowired
  public TokenUsageLog(ChatUsageProperties properties, MeterRegistry meterRegistry) {
    this(properties, meterRegistry, Clock.systemUTC());
  }

  TokenUsageLog(ChatUsageProperties properties, MeterRegistry meterRegistry, Clock clock) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.meterRegistry = meterRegistry;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.capacity = Math.max(1, properties.getCapacity());
    if (meterRegistry != null) {
      Gauge.builder("chat_usage_log_size", this, TokenUsageLog::size)
          .description("Number of token usage records retained in memory")
          .register(meterRegistry);
    }
  }

  public void record(UsageOperation operation, String model, int totalTokens, String userId) {
    Objects.requireNonNull(operation, "operation must not be null");
    UsageRecord entry =
        new UsageRecord(operation, model, Math.max(0, totalTokens), userId, clock.instant());
    synchronized (this) {
      entries.addLast(entry);
      while (entries.size() > capacity) {
        entries.removeFirst();
      }
    }
    if (meterRegistry != null) {
      meterRegistry
          .counter(
              "chat_usage_tokens_total",
              "operation",
              operation.name().toLowerCase(),
              "model",
              model != null ? model : "unknown")
          .increment(entry.totalTokens());
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Token usage logged: operation={}, model={}, tokens={}, user={}, estimatedCost={}",
          operation,
          model,
          entry.totalTokens(),
          userId,
          estimateCost(entry.totalTokens(), model));
    }
  }

  public synchronized int size() {
    return entries.size();
  }

  /** Most recent records, newest first. */
  public synchronized List<UsageRecord> recent(int limit) {
    List<UsageRecord> result = new ArrayList<>(Math.min(Math.max(limit, 0), entries.size()));
    Iterator<UsageRecord> iterator = entries.descendingIterator();
    while (iterator.hasNext() && result.size() < limit) {
      result.add(iterator.next());
    }
    return result;
  }

  public UsageSnapshot snapshot() {
    List<UsageRecord> copy;
    synchronized (this) {
      copy = new ArrayList<>(entries);
    }
    Map<UsageOperation, Long> tokensByOperation = new EnumMap<>(UsageOperation.class);
    long totalTokens = 0;
    BigDecimal cost = BigDecimal.ZERO;
    Instant oldest = null;
    Instant newest = null;
    for (UsageRecord entry : copy) {
      totalTokens += entry.totalTokens();
      tokensByOperation.merge(entry.operation(), (long) entry.totalTokens(), Long::sum);
      cost = cost.add(estimateCost(entry.totalTokens(), entry.model()));
      if (oldest == null || entry.timestamp().isBefore(oldest)) {
        oldest = entry.timestamp();
      }
      if (newest == null || entry.timestamp().isAfter(newest)) {
        newest = entry.timestamp();
      }
    }
    return new UsageSnapshot(copy.size(), totalTokens, tokensByOperation, cost, oldest, newest);
  }

  /** Approximate cost assuming an even split between input and output tokens. */
  public BigDecimal estimateCost(int tokens, String model) {
    ChatUsageProperties.Pricing pricing = properties.pricingFor(model);
    if (pricing == null || tokens <= 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal half = BigDecimal.valueOf(tokens).multiply(HALF);
    BigDecimal input = per1K(half, pricing.getInputPer1KTokens());
    BigDecimal output = per1K(half, pricing.getOutputPer1KTokens());
    return input.add(output).setScale(COST_SCALE, RoundingMode.HALF_UP);
  }

  private BigDecimal per1K(BigDecimal tokens, BigDecimal price) {
    if (price == null) {
      return BigDecimal.ZERO;
    }
    return tokens.multiply(price).divide(ONE_THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
  }

  public record UsageRecord(
      UsageOperation operation, String model, int totalTokens, String userId, Instant timestamp) {}

  public record UsageSnapshot(
      int totalEntries,
      long totalTokens,
      Map<UsageOperation, Long> tokensByOperation,
      BigDecimal estimatedCost,
      Instant oldestEntry,
      Instant newestEntry) {}
}
