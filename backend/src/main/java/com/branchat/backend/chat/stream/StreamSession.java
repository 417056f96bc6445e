package com.branchat.backend.chat.stream;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import reactor.core.Disposable;

/**
 * One generation relayed to a connected client. State changes are compare-and-set so that exactly
 * one caller wins the transition into a terminal state.
 */
public class StreamSession {

  private final UUID id = UUID.randomUUID();
  private final String clientId;
  private final UUID conversationId;
  private final Instant startedAt;
  private final AtomicReference<StreamSessionState> state =
      new AtomicReference<>(StreamSessionState.INIT);
  private final AtomicReference<Disposable> subscription = new AtomicReference<>();
  private final StringBuilder accumulatedText = new StringBuilder();
  private int tokenCount;

  StreamSession(String clientId, UUID conversationId, Instant startedAt) {
    this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
    this.conversationId = conversationId;
    this.startedAt = startedAt;
  }

  public UUID getId() {
    return id;
  }

  public String getClientId() {
    return clientId;
  }

  public UUID getConversationId() {
    return conversationId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public StreamSessionState getState() {
    return state.get();
  }

  public boolean isStreaming() {
    return state.get() == StreamSessionState.STREAMING;
  }

  public synchronized String getAccumulatedText() {
    return accumulatedText.toString();
  }

  public synchronized int getTokenCount() {
    return tokenCount;
  }

  /**
   * Moves the session from {@code expected} to {@code next}.
   *
   * @return {@code false} when the session was not in {@code expected}
   * @throws IllegalStateException if the transition is not part of the session lifecycle
   */
  boolean transition(StreamSessionState expected, StreamSessionState next) {
    if (!expected.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal stream session transition " + expected + " -> " + next);
    }
    return state.compareAndSet(expected, next);
  }

  /** Moves a live session to DISCONNECTED, whichever non-terminal state it is in. */
  boolean markDisconnected() {
    while (true) {
      StreamSessionState current = state.get();
      if (current.isTerminal()) {
        return false;
      }
      if (state.compareAndSet(current, StreamSessionState.DISCONNECTED)) {
        return true;
      }
    }
  }

  /** Appends a chunk and returns its zero-based index. */
  synchronized int append(String chunk) {
    accumulatedText.append(chunk);
    return tokenCount++;
  }

  void attach(Disposable disposable) {
    subscription.set(disposable);
    if (state.get().isTerminal()) {
      release();
    }
  }

  void release() {
    Disposable disposable = subscription.getAndSet(null);
    if (disposable != null && !disposable.isDisposed()) {
      disposable.dispose();
    }
  }
}
