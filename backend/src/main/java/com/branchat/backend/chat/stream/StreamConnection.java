package com.branchat.backend.chat.stream;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/** Registered push channel of one client and the generation currently relayed over it. */
@Slf4j
final class StreamConnection {

  private final String clientId;
  private final StreamEventSink sink;
  private final Instant connectedAt;
  private final AtomicReference<StreamSession> activeSession = new AtomicReference<>();
  private boolean open = true;

  StreamConnection(String clientId, StreamEventSink sink, Instant connectedAt) {
    this.clientId = clientId;
    this.sink = sink;
    this.connectedAt = connectedAt;
  }

  String clientId() {
    return clientId;
  }

  StreamEventSink sink() {
    return sink;
  }

  Instant connectedAt() {
    return connectedAt;
  }

  synchronized boolean isOpen() {
    return open;
  }

  StreamSession activeSession() {
    return activeSession.get();
  }

  boolean claim(StreamSession session) {
    StreamSession current = activeSession.get();
    if (current != null && !current.getState().isTerminal()) {
      return false;
    }
    return activeSession.compareAndSet(current, session);
  }

  void releaseSession(StreamSession session) {
    activeSession.compareAndSet(session, null);
  }

  /**
   * Sends an event unless the channel is closed. A failed write closes the channel.
   *
   * @return {@code true} when the event was written
   */
  synchronized boolean send(String eventName, Object payload) {
    if (!open) {
      return false;
    }
    try {
      sink.send(eventName, payload);
      return true;
    } catch (IOException | IllegalStateException ex) {
      log.debug("Failed to push {} to client {}: {}", eventName, clientId, ex.getMessage());
      open = false;
      return false;
    }
  }

  /**
   * Sends a session event only while the session is still in {@code requiredState}. Holding the
   * channel monitor keeps a concurrent close from interleaving with the check.
   */
  synchronized boolean sendWhile(
      StreamSession session, StreamSessionState requiredState, String eventName, Object payload) {
    if (session.getState() != requiredState) {
      return false;
    }
    return send(eventName, payload);
  }

  /**
   * Closes the channel and moves a live session to DISCONNECTED under the channel monitor, so no
   * event of that session can be written afterwards.
   *
   * @return the session that was disconnected by this call, or {@code null}
   */
  synchronized StreamSession close() {
    open = false;
    StreamSession session = activeSession.getAndSet(null);
    if (session != null && session.markDisconnected()) {
      return session;
    }
    return null;
  }
}
