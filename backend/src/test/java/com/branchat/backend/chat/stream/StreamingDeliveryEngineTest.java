package com.branchat.backend.chat.stream;

import static com.branchat.backend.chat.TestChatDataFactory.conversation;
import static com.branchat.backend.chat.TestChatDataFactory.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.branchat.backend.chat.api.StreamEvent;
import com.branchat.backend.chat.config.ChatStreamProperties;
import com.branchat.backend.chat.config.ChatUsageProperties;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.chat.token.TokenUsageLog;
import com.branchat.backend.chat.token.UsageOperation;
import com.branchat.backend.common.exception.RequestValidationException;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Sinks;

@ExtendWith(MockitoExtension.class)
class StreamingDeliveryEngineTest {

  private static final String CLIENT_ID = "client-1";
  private static final String MODEL = "gpt-test";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private GenerationProvider generationProvider;
  @Mock private MessageStore messageStore;

  private final UUID conversationId = UUID.randomUUID();
  private final AtomicBoolean upstreamCancelled = new AtomicBoolean();
  private Sinks.Many<String> upstream;
  private ChatStreamProperties properties;
  private TokenUsageLog usageLog;
  private SimpleMeterRegistry meterRegistry;
  private StreamingDeliveryEngine engine;

  @BeforeEach
  void setUp() {
    upstream = Sinks.many().unicast().onBackpressureBuffer();
    properties = new ChatStreamProperties();
    meterRegistry = new SimpleMeterRegistry();
    usageLog = new TokenUsageLog(new ChatUsageProperties(), null);
    engine = newEngine(null);
  }

  @AfterEach
  void tearDown() {
    engine.disconnectAll();
    meterRegistry.close();
  }

  @Test
  void connectSendsConnectedEvent() {
    RecordingEventSink sink = new RecordingEventSink();

    engine.initialize(CLIENT_ID, sink);

    assertThat(sink.eventNames()).containsExactly("connected");
    StreamEvent connected = (StreamEvent) sink.last().payload();
    assertThat(connected.clientId()).isEqualTo(CLIENT_ID);
    assertThat(connected.timestamp()).isEqualTo(NOW);
    assertThat(engine.isClientConnected(CLIENT_ID)).isTrue();
    assertThat(meterRegistry.get("chat_stream_connections").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void relaysTokensAndPersistsCompletedResponse() {
    RecordingEventSink sink = connect();
    ChatMessage stored = storedMessage("Hello world");
    when(messageStore.append(any(NewMessage.class))).thenReturn(stored);

    stubUpstream();
    StreamSession session = startStream();
    upstream.tryEmitNext("Hello");
    upstream.tryEmitNext(" world");
    upstream.tryEmitComplete();

    assertThat(sink.eventNames())
        .containsExactly("connected", "stream_start", "token", "token", "stream_complete");
    StreamEvent firstToken = (StreamEvent) sink.events().get(2).payload();
    assertThat(firstToken.content()).isEqualTo("Hello");
    assertThat(firstToken.tokenIndex()).isZero();
    StreamEvent complete = (StreamEvent) sink.last().payload();
    assertThat(complete.messageId()).isEqualTo(stored.getId());
    assertThat(complete.fullResponse()).isEqualTo("Hello world");
    assertThat(complete.tokenCount()).isEqualTo(2);
    assertThat(complete.metadata().model()).isEqualTo(MODEL);
    assertThat(complete.metadata().tokens()).isEqualTo(11);

    ArgumentCaptor<NewMessage> captor = ArgumentCaptor.forClass(NewMessage.class);
    verify(messageStore).append(captor.capture());
    assertThat(captor.getValue().conversationId()).isEqualTo(conversationId);
    assertThat(captor.getValue().role()).isEqualTo(ChatRole.ASSISTANT);
    assertThat(captor.getValue().content()).isEqualTo("Hello world");
    assertThat(captor.getValue().model()).isEqualTo(MODEL);

    assertThat(session.getState()).isEqualTo(StreamSessionState.COMPLETED);
    assertThat(engine.findActiveSession(CLIENT_ID)).isEmpty();
    assertThat(usageLog.recent(1).get(0).operation()).isEqualTo(UsageOperation.CHAT);
    assertThat(meterRegistry.counter("chat_stream_completed_total").count()).isEqualTo(1.0);
  }

  @Test
  void providerErrorEndsStreamWithErrorEventAndNothingStored() {
    RecordingEventSink sink = connect();

    stubUpstream();
    StreamSession session = startStream();
    upstream.tryEmitNext("partial");
    upstream.tryEmitError(new IllegalStateException("upstream reset"));

    assertThat(sink.eventNames())
        .containsExactly("connected", "stream_start", "token", "stream_error");
    assertThat(((StreamEvent) sink.last().payload()).error())
        .isEqualTo("Failed to stream response from model: upstream reset");
    assertThat(session.getState()).isEqualTo(StreamSessionState.ERRORED);
    verify(messageStore, never()).append(any());
    assertThat(engine.isClientConnected(CLIENT_ID)).isTrue();
  }

  @Test
  void providerErrorStoresPartialTextWhenEnabled() {
    properties.setPersistPartialOnError(true);
    connect();
    when(messageStore.append(any(NewMessage.class))).thenReturn(storedMessage("partial"));

    stubUpstream();
    startStream();
    upstream.tryEmitNext("partial");
    upstream.tryEmitError(new IllegalStateException("upstream reset"));

    ArgumentCaptor<NewMessage> captor = ArgumentCaptor.forClass(NewMessage.class);
    verify(messageStore).append(captor.capture());
    assertThat(captor.getValue().content()).isEqualTo("partial");
  }

  @Test
  void emptyResponseIsReportedAsError() {
    RecordingEventSink sink = connect();

    stubUpstream();
    StreamSession session = startStream();
    upstream.tryEmitComplete();

    assertThat(sink.eventNames()).containsExactly("connected", "stream_start", "stream_error");
    assertThat(((StreamEvent) sink.last().payload()).error())
        .isEqualTo("Model returned an empty response");
    assertThat(session.getState()).isEqualTo(StreamSessionState.ERRORED);
  }

  @Test
  void clientDisconnectCancelsUpstreamAndSuppressesFurtherEvents() {
    RecordingEventSink sink = connect();

    stubUpstream();
    StreamSession session = startStream();
    upstream.tryEmitNext("Hello");
    sink.closeFromClient();
    upstream.tryEmitNext(" ignored");
    upstream.tryEmitComplete();

    assertThat(sink.eventNames()).containsExactly("connected", "stream_start", "token");
    assertThat(session.getState()).isEqualTo(StreamSessionState.DISCONNECTED);
    assertThat(upstreamCancelled).isTrue();
    assertThat(engine.isClientConnected(CLIENT_ID)).isFalse();
    assertThat(engine.connectedCount()).isZero();
    verify(messageStore, never()).append(any());
    assertThat(meterRegistry.counter("chat_stream_disconnects_total").count()).isEqualTo(1.0);
  }

  @Test
  void failedWriteClosesChannelAndAbortsGeneration() {
    RecordingEventSink sink = connect();
    sink.failOn("token");

    stubUpstream();
    StreamSession session = startStream();
    upstream.tryEmitNext("Hello");

    assertThat(session.getState()).isEqualTo(StreamSessionState.DISCONNECTED);
    assertThat(upstreamCancelled).isTrue();
    assertThat(engine.isClientConnected(CLIENT_ID)).isFalse();
  }

  @Test
  void rejectsSecondStreamWhileOneIsActive() {
    connect();
    stubUpstream();
    startStream();

    assertThatThrownBy(this::startStream)
        .isInstanceOf(RequestValidationException.class)
        .hasMessageContaining("already has an active stream");
  }

  @Test
  void reservationBlocksOtherStreamsUntilReleased() {
    connect();
    StreamSession reserved = engine.reserve(CLIENT_ID, conversationId);

    assertThat(reserved.getState()).isEqualTo(StreamSessionState.INIT);
    assertThatThrownBy(() -> engine.reserve(CLIENT_ID, conversationId))
        .isInstanceOf(RequestValidationException.class)
        .hasMessageContaining("already has an active stream");

    engine.release(reserved);

    assertThat(engine.findActiveSession(CLIENT_ID)).isEmpty();
    assertThat(engine.reserve(CLIENT_ID, conversationId)).isNotSameAs(reserved);
  }

  @Test
  void reservedSessionStartsStreaming() {
    RecordingEventSink sink = connect();
    stubUpstream();
    StreamSession reserved = engine.reserve(CLIENT_ID, conversationId);

    StreamSession started =
        engine.streamGeneration(
            reserved,
            new StreamGenerationRequest(
                CLIENT_ID,
                conversationId,
                "user-1",
                List.of(PromptMessage.user("Say hello")),
                GenerationOptions.empty()));

    assertThat(started).isSameAs(reserved);
    assertThat(started.getState()).isEqualTo(StreamSessionState.STREAMING);
    assertThat(sink.eventNames()).containsExactly("connected", "stream_start");

    engine.release(started);

    assertThat(engine.findActiveSession(CLIENT_ID)).contains(started);
  }

  @Test
  void reservationLostToReconnectIsNotStarted() {
    connect();
    StreamSession reserved = engine.reserve(CLIENT_ID, conversationId);
    engine.initialize(CLIENT_ID, new RecordingEventSink());

    StreamSession returned =
        engine.streamGeneration(
            reserved,
            new StreamGenerationRequest(
                CLIENT_ID,
                conversationId,
                "user-1",
                List.of(PromptMessage.user("Say hello")),
                GenerationOptions.empty()));

    assertThat(returned.getState()).isEqualTo(StreamSessionState.DISCONNECTED);
    verify(generationProvider, never()).completeStreaming(any(), any());
  }

  @Test
  void rejectsStreamForUnknownClient() {
    assertThatThrownBy(this::startStream).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void reconnectReplacesPreviousChannel() {
    RecordingEventSink first = connect();
    RecordingEventSink second = new RecordingEventSink();

    engine.initialize(CLIENT_ID, second);

    assertThat(first.isClosed()).isTrue();
    assertThat(engine.connectedCount()).isEqualTo(1);
    assertThat(second.eventNames()).containsExactly("connected");

    first.closeFromClient();

    assertThat(engine.isClientConnected(CLIENT_ID)).isTrue();
  }

  @Test
  void heartbeatsAndBroadcastsReachEveryClient() {
    RecordingEventSink first = connect();
    RecordingEventSink second = new RecordingEventSink();
    engine.initialize("client-2", second);

    assertThat(engine.sendHeartbeats()).isEqualTo(2);
    assertThat(engine.sendCustomEvent("client-2", "notice", "hello")).isTrue();
    assertThat(engine.sendCustomEvent("missing", "notice", "hello")).isFalse();

    assertThat(first.eventNames()).containsExactly("connected", "heartbeat");
    assertThat(second.eventNames()).containsExactly("connected", "heartbeat", "notice");
  }

  @Test
  void schedulesHeartbeatWithConfiguredInterval(
      @Mock TaskScheduler taskScheduler) {
    properties.setHeartbeatInterval(Duration.ofSeconds(15));
    StreamingDeliveryEngine scheduled = newEngine(taskScheduler);

    scheduled.scheduleHeartbeat();

    verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(15)));
  }

  @Test
  void rejectsBlankClientId() {
    assertThatThrownBy(() -> engine.initialize(" ", new RecordingEventSink()))
        .isInstanceOf(RequestValidationException.class);
  }

  private StreamingDeliveryEngine newEngine(TaskScheduler taskScheduler) {
    return new StreamingDeliveryEngine(
        generationProvider,
        messageStore,
        String::length,
        usageLog,
        properties,
        taskScheduler,
        meterRegistry,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private RecordingEventSink connect() {
    RecordingEventSink sink = new RecordingEventSink();
    engine.initialize(CLIENT_ID, sink);
    return sink;
  }

  private void stubUpstream() {
    when(generationProvider.modelId()).thenReturn(MODEL);
    when(generationProvider.completeStreaming(any(), any()))
        .thenReturn(upstream.asFlux().doOnCancel(() -> upstreamCancelled.set(true)));
  }

  private StreamSession startStream() {
    return engine.streamGeneration(
        new StreamGenerationRequest(
            CLIENT_ID,
            conversationId,
            "user-1",
            List.of(PromptMessage.user("Say hello")),
            GenerationOptions.empty()));
  }

  private ChatMessage storedMessage(String content) {
    Conversation conversation = conversation(conversationId, "user-1", "Test");
    return message(conversation, ChatRole.ASSISTANT, content, 2);
  }
}
