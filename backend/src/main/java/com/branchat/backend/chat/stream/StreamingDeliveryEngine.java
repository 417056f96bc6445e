package com.branchat.backend.chat.stream;

import com.branchat.backend.chat.api.StreamEvent;
import com.branchat.backend.chat.api.StreamMessageMetadata;
import com.branchat.backend.chat.config.ChatStreamProperties;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.chat.token.TokenUsageLog;
import com.branchat.backend.chat.token.UsageOperation;
import com.branchat.backend.common.exception.RequestValidationException;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;

/**
 * Registry of connected push clients and relay of streamed generations to them.
 *
 * <p>Each client owns one channel. A generation started on that channel runs as a {@link
 * StreamSession} moving through {@code INIT -> STREAMING -> COMPLETED | ERRORED | DISCONNECTED}.
 * Token events are only written while the session is streaming; the terminal event is written by
 * whichever callback wins the terminal transition. Closing the channel, from either side, disposes
 * the in-flight provider subscription.
 */
@Slf4j
@Service
public class StreamingDeliveryEngine {

  private final Map<String, StreamConnection> connections = new ConcurrentHashMap<>();

  private final GenerationProvider generationProvider;
  private final MessageStore messageStore;
  private final TokenEstimator tokenEstimator;
  private final TokenUsageLog usageLog;
  private final ChatStreamProperties properties;
  private final TaskScheduler taskScheduler;
  private final Clock clock;
  private final Counter completedCounter;
  private final Counter erroredCounter;
  private final Counter disconnectedCounter;

  private volatile ScheduledFuture<?> heartbeatTask;

  @Autowired
  public StreamingDeliveryEngine(
      GenerationProvider generationProvider,
      MessageStore messageStore,
      TokenEstimator tokenEstimator,
      TokenUsageLog usageLog,
      ChatStreamProperties properties,
      @Nullable TaskScheduler taskScheduler,
      @Nullable MeterRegistry meterRegistry) {
    this(
        generationProvider,
        messageStore,
        tokenEstimator,
        usageLog,
        properties,
        taskScheduler,
        meterRegistry,
        Clock.systemUTC());
  }

  StreamingDeliveryEngine(
      GenerationProvider generationProvider,
      MessageStore messageStore,
      TokenEstimator tokenEstimator,
      TokenUsageLog usageLog,
      ChatStreamProperties properties,
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    this.usageLog = Objects.requireNonNull(usageLog, "usageLog must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.taskScheduler = taskScheduler;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (meterRegistry != null) {
      Gauge.builder("chat_stream_connections", connections, Map::size)
          .description("Number of connected streaming clients")
          .register(meterRegistry);
      this.completedCounter = meterRegistry.counter("chat_stream_completed_total");
      this.erroredCounter = meterRegistry.counter("chat_stream_errors_total");
      this.disconnectedCounter = meterRegistry.counter("chat_stream_disconnects_total");
    } else {
      this.completedCounter = null;
      this.erroredCounter = null;
      this.disconnectedCounter = null;
    }
  }

  @PostConstruct
  void scheduleHeartbeat() {
    Duration interval = properties.getHeartbeatInterval();
    if (taskScheduler == null || interval == null || interval.isZero() || interval.isNegative()) {
      log.info("Stream heartbeat disabled (interval={})", interval);
      return;
    }
    heartbeatTask = taskScheduler.scheduleWithFixedDelay(this::safeHeartbeat, interval);
    log.info("Stream heartbeat scheduled every {}", interval);
  }

  /**
   * Registers a client channel and sends the {@code connected} event. A channel already registered
   * under the same client id is closed first.
   */
  public void initialize(String clientId, StreamEventSink sink) {
    if (!StringUtils.hasText(clientId)) {
      throw new RequestValidationException("clientId must not be blank");
    }
    Objects.requireNonNull(sink, "sink must not be null");
    StreamConnection connection = new StreamConnection(clientId, sink, clock.instant());
    StreamConnection previous = connections.put(clientId, connection);
    if (previous != null) {
      log.info("Client {} reconnected, closing previous channel", clientId);
      closeConnection(previous, true);
    }
    sink.onClose(() -> handleTransportClosed(connection));
    if (!connection.send(
        StreamEventType.CONNECTED.eventName(),
        StreamEvent.connected(clientId, connection.connectedAt()))) {
      handleTransportClosed(connection);
      return;
    }
    log.info("Stream client {} connected ({} total)", clientId, connections.size());
  }

  /**
   * Starts relaying a generation to the client's channel. The returned session is already
   * streaming; completion, failure and persistence happen on the provider's callbacks.
   *
   * @throws ResourceNotFoundException if the client has no open channel
   * @throws RequestValidationException if a generation is already streaming to the client
   */
  public StreamSession streamGeneration(StreamGenerationRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    return streamGeneration(reserve(request.clientId(), request.conversationId()), request);
  }

  /**
   * Claims the client's channel for a generation that has not started yet. The session stays in
   * {@code INIT} until {@link #streamGeneration(StreamSession, StreamGenerationRequest)} runs it or
   * {@link #release(StreamSession)} gives the channel back.
   *
   * @throws ResourceNotFoundException if the client has no open channel
   * @throws RequestValidationException if a generation is already streaming to the client
   */
  public StreamSession reserve(String clientId, UUID conversationId) {
    StreamConnection connection = clientId == null ? null : connections.get(clientId);
    if (connection == null || !connection.isOpen()) {
      throw new ResourceNotFoundException("Stream client", clientId);
    }
    StreamSession session = new StreamSession(clientId, conversationId, clock.instant());
    if (!connection.claim(session)) {
      throw new RequestValidationException("Client " + clientId + " already has an active stream");
    }
    return session;
  }

  /** Frees a reservation that never started streaming. */
  public void release(StreamSession session) {
    if (session == null || session.getState() != StreamSessionState.INIT) {
      return;
    }
    StreamConnection connection = connections.get(session.getClientId());
    if (connection != null) {
      connection.releaseSession(session);
    }
  }

  /**
   * Runs a generation on a previously reserved session. A reservation lost to a disconnect or
   * reconnect is returned unchanged.
   */
  public StreamSession streamGeneration(StreamSession session, StreamGenerationRequest request) {
    Objects.requireNonNull(session, "session must not be null");
    Objects.requireNonNull(request, "request must not be null");
    StreamConnection connection = connections.get(session.getClientId());
    if (connection == null
        || connection.activeSession() != session
        || !session.transition(StreamSessionState.INIT, StreamSessionState.STREAMING)) {
      log.debug(
          "Stream {} for client {} lost its reservation before starting",
          session.getId(),
          session.getClientId());
      return session;
    }
    String model = generationProvider.modelId();
    connection.sendWhile(
        session,
        StreamSessionState.STREAMING,
        StreamEventType.STREAM_START.eventName(),
        StreamEvent.streamStart(model, session.getStartedAt()));

    Disposable subscription =
        generationProvider
            .completeStreaming(request.messages(), request.options())
            .subscribe(
                chunk -> handleChunk(connection, session, chunk),
                error -> handleError(connection, session, request, error),
                () -> handleCompletion(connection, session, request, model));
    session.attach(subscription);
    log.debug(
        "Stream {} started for client {} in conversation {}",
        session.getId(),
        request.clientId(),
        request.conversationId());
    return session;
  }

  /** Closes the client's channel and aborts its in-flight generation. */
  public boolean disconnect(String clientId) {
    if (clientId == null) {
      return false;
    }
    StreamConnection connection = connections.remove(clientId);
    if (connection == null) {
      return false;
    }
    closeConnection(connection, true);
    log.info("Stream client {} disconnected", clientId);
    return true;
  }

  @PreDestroy
  public void disconnectAll() {
    ScheduledFuture<?> task = heartbeatTask;
    if (task != null) {
      task.cancel(false);
      heartbeatTask = null;
    }
    List<String> clientIds = new ArrayList<>(connections.keySet());
    clientIds.forEach(this::disconnect);
    if (!clientIds.isEmpty()) {
      log.info("Disconnected {} stream client(s)", clientIds.size());
    }
  }

  public int connectedCount() {
    return connections.size();
  }

  public boolean isClientConnected(String clientId) {
    StreamConnection connection = clientId != null ? connections.get(clientId) : null;
    return connection != null && connection.isOpen();
  }

  public Optional<StreamSession> findActiveSession(String clientId) {
    StreamConnection connection = clientId != null ? connections.get(clientId) : null;
    return Optional.ofNullable(connection).map(StreamConnection::activeSession);
  }

  /** Pushes an application-defined event to one client. */
  public boolean sendCustomEvent(String clientId, String eventName, Object payload) {
    if (!StringUtils.hasText(eventName)) {
      throw new RequestValidationException("eventName must not be blank");
    }
    StreamConnection connection = clientId != null ? connections.get(clientId) : null;
    if (connection == null) {
      return false;
    }
    return deliver(connection, eventName, payload);
  }

  /**
   * Pushes an event to every connected client.
   *
   * @return number of clients the event was written to
   */
  public int broadcast(String eventName, Object payload) {
    if (!StringUtils.hasText(eventName)) {
      throw new RequestValidationException("eventName must not be blank");
    }
    int delivered = 0;
    for (StreamConnection connection : new ArrayList<>(connections.values())) {
      if (deliver(connection, eventName, payload)) {
        delivered++;
      }
    }
    return delivered;
  }

  int sendHeartbeats() {
    return broadcast(StreamEventType.HEARTBEAT.eventName(), StreamEvent.heartbeat(clock.instant()));
  }

  private void safeHeartbeat() {
    try {
      int delivered = sendHeartbeats();
      if (log.isTraceEnabled()) {
        log.trace("Heartbeat delivered to {} client(s)", delivered);
      }
    } catch (RuntimeException ex) {
      log.warn("Stream heartbeat failed", ex);
    }
  }

  private boolean deliver(StreamConnection connection, String eventName, Object payload) {
    if (connection.send(eventName, payload)) {
      return true;
    }
    handleTransportClosed(connection);
    return false;
  }

  private void handleChunk(StreamConnection connection, StreamSession session, String chunk) {
    if (!StringUtils.hasLength(chunk) || !session.isStreaming()) {
      return;
    }
    int index = session.append(chunk);
    if (log.isDebugEnabled()) {
      log.debug("Stream {} chunk #{}: {}", session.getId(), index, chunk);
    }
    boolean sent =
        connection.sendWhile(
            session,
            StreamSessionState.STREAMING,
            StreamEventType.TOKEN.eventName(),
            StreamEvent.token(chunk, index));
    if (!sent && !connection.isOpen()) {
      handleTransportClosed(connection);
    }
  }

  private void handleCompletion(
      StreamConnection connection,
      StreamSession session,
      StreamGenerationRequest request,
      String model) {
    if (!session.isStreaming()) {
      return;
    }
    String fullResponse = session.getAccumulatedText();
    if (!StringUtils.hasText(fullResponse)) {
      fail(connection, session, request, "Model returned an empty response", null);
      return;
    }
    long processingTimeMs = elapsedMillis(session);
    int tokens = tokenEstimator.estimate(fullResponse);
    ChatMessage saved;
    try {
      saved =
          messageStore.append(
              NewMessage.of(request.conversationId(), ChatRole.ASSISTANT, fullResponse)
                  .withMetadata(tokens, model, processingTimeMs));
    } catch (RuntimeException ex) {
      log.error(
          "Failed to persist streamed response for conversation {}", request.conversationId(), ex);
      fail(connection, session, request, "Failed to store the generated response", null);
      return;
    }
    usageLog.record(
        UsageOperation.CHAT, model, promptTokens(request) + tokens, request.userId());
    if (!session.transition(StreamSessionState.STREAMING, StreamSessionState.COMPLETED)) {
      log.info(
          "Stream {} ended before completion; response stored as message {}",
          session.getId(),
          saved.getId());
      return;
    }
    connection.releaseSession(session);
    increment(completedCounter);
    connection.send(
        StreamEventType.STREAM_COMPLETE.eventName(),
        StreamEvent.complete(
            saved.getId(),
            fullResponse,
            session.getTokenCount(),
            new StreamMessageMetadata(tokens, model, processingTimeMs),
            clock.instant()));
    log.info(
        "Stream {} completed: {} chunk(s), message {}",
        session.getId(),
        session.getTokenCount(),
        saved.getId());
  }

  private void handleError(
      StreamConnection connection,
      StreamSession session,
      StreamGenerationRequest request,
      Throwable error) {
    log.error("Streaming generation failed for client {}", session.getClientId(), error);
    fail(connection, session, request, buildErrorMessage(error), error);
  }

  private void fail(
      StreamConnection connection,
      StreamSession session,
      StreamGenerationRequest request,
      String message,
      Throwable cause) {
    if (!session.transition(StreamSessionState.STREAMING, StreamSessionState.ERRORED)) {
      return;
    }
    connection.releaseSession(session);
    session.release();
    increment(erroredCounter);
    if (cause != null && properties.isPersistPartialOnError()) {
      persistPartial(session, request);
    }
    connection.send(
        StreamEventType.STREAM_ERROR.eventName(), StreamEvent.error(message, clock.instant()));
  }

  private void persistPartial(StreamSession session, StreamGenerationRequest request) {
    String partial = session.getAccumulatedText();
    if (!StringUtils.hasText(partial)) {
      return;
    }
    try {
      ChatMessage saved =
          messageStore.append(
              NewMessage.of(request.conversationId(), ChatRole.ASSISTANT, partial)
                  .withMetadata(
                      tokenEstimator.estimate(partial),
                      generationProvider.modelId(),
                      elapsedMillis(session)));
      log.info("Stored partial response of stream {} as message {}", session.getId(), saved.getId());
    } catch (RuntimeException ex) {
      log.warn("Failed to store partial response of stream {}", session.getId(), ex);
    }
  }

  private void handleTransportClosed(StreamConnection connection) {
    connections.remove(connection.clientId(), connection);
    closeConnection(connection, false);
  }

  private void closeConnection(StreamConnection connection, boolean closeSink) {
    StreamSession interrupted = connection.close();
    if (interrupted != null) {
      interrupted.release();
      increment(disconnectedCounter);
      log.info(
          "Stream {} for client {} aborted by disconnect after {} chunk(s)",
          interrupted.getId(),
          connection.clientId(),
          interrupted.getTokenCount());
    }
    if (closeSink) {
      try {
        connection.sink().close();
      } catch (RuntimeException ex) {
        log.debug("Closing channel of client {} failed: {}", connection.clientId(), ex.getMessage());
      }
    }
  }

  private long elapsedMillis(StreamSession session) {
    return Math.max(0L, Duration.between(session.getStartedAt(), clock.instant()).toMillis());
  }

  private int promptTokens(StreamGenerationRequest request) {
    return request.messages().stream()
        .mapToInt(message -> tokenEstimator.estimate(message.content()))
        .sum();
  }

  private String buildErrorMessage(Throwable error) {
    String message = error != null ? error.getMessage() : null;
    if (!StringUtils.hasText(message)) {
      message = error != null ? error.getClass().getSimpleName() : "unknown error";
    }
    return "Failed to stream response from model: " + message;
  }

  private static void increment(Counter counter) {
    if (counter != null) {
      counter.increment();
    }
  }
}
