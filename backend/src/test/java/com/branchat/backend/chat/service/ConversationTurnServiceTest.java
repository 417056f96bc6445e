package com.branchat.backend.chat.service;

import static com.branchat.backend.chat.TestChatDataFactory.conversation;
import static com.branchat.backend.chat.TestChatDataFactory.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.branchat.backend.chat.context.AssembledContext;
import com.branchat.backend.chat.context.ContextAssembler;
import com.branchat.backend.chat.context.ContextMetadata;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.GenerationUnavailableException;
import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.chat.stream.StreamGenerationRequest;
import com.branchat.backend.chat.stream.StreamSession;
import com.branchat.backend.chat.stream.StreamingDeliveryEngine;
import com.branchat.backend.common.exception.RequestValidationException;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConversationTurnServiceTest {

  private static final String USER_ID = "user-1";

  @Mock private ConversationService conversationService;
  @Mock private MessageStore messageStore;
  @Mock private ContextAssembler contextAssembler;
  @Mock private GenerationProvider generationProvider;
  @Mock private StreamingDeliveryEngine streamingEngine;

  private final AtomicInteger sequence = new AtomicInteger();
  private final ContextMetadata metadata = new ContextMetadata(2, 0, 0, 0, 40, 4000, false);
  private Conversation conversation;
  private ConversationTurnService service;

  @BeforeEach
  void setUp() {
    conversation = conversation(UUID.randomUUID(), USER_ID, "Turns");
    service =
        new ConversationTurnService(
            conversationService,
            messageStore,
            contextAssembler,
            generationProvider,
            streamingEngine,
            String::length,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void sendMessageStoresBothSidesOfTheTurn() {
    givenAppendEchoes();
    List<PromptMessage> prompt = List.of(PromptMessage.user("What is MVCC?"));
    when(contextAssembler.assemble(conversation.getId(), "What is MVCC?", null))
        .thenReturn(new AssembledContext(prompt, metadata));
    GenerationOptions options = new GenerationOptions(0.2, 256);
    when(generationProvider.complete(prompt, options)).thenReturn("Multi-version concurrency.");
    when(generationProvider.modelId()).thenReturn("gpt-4o-mini");

    TurnResult result =
        service.sendMessage(
            conversation.getId(), USER_ID, new TurnCommand("  What is MVCC? ", null, options));

    assertThat(result.userMessage().getContent()).isEqualTo("What is MVCC?");
    assertThat(result.assistantMessage().getContent()).isEqualTo("Multi-version concurrency.");
    assertThat(result.context()).isEqualTo(metadata);
    verify(conversationService).requireOwned(conversation.getId(), USER_ID);

    ArgumentCaptor<NewMessage> captor = ArgumentCaptor.forClass(NewMessage.class);
    verify(messageStore, times(2)).append(captor.capture());
    NewMessage assistant = captor.getAllValues().get(1);
    assertThat(assistant.role()).isEqualTo(ChatRole.ASSISTANT);
    assertThat(assistant.tokens()).isEqualTo("Multi-version concurrency.".length());
    assertThat(assistant.model()).isEqualTo("gpt-4o-mini");
    assertThat(assistant.processingTimeMs()).isZero();
  }

  @Test
  void completionFailureLeavesOnlyTheUserMessage() {
    givenAppendEchoes();
    when(contextAssembler.assemble(eq(conversation.getId()), eq("Hello"), any()))
        .thenReturn(new AssembledContext(List.of(PromptMessage.user("Hello")), metadata));
    when(generationProvider.complete(any(), any()))
        .thenThrow(new GenerationUnavailableException("model offline"));

    assertThatThrownBy(
            () ->
                service.sendMessage(
                    conversation.getId(), USER_ID, new TurnCommand("Hello", null, null)))
        .isInstanceOf(GenerationUnavailableException.class);
    verify(messageStore).append(any());
  }

  @Test
  void blankContentIsRejectedBeforeAnythingIsStored() {
    assertThatThrownBy(
            () ->
                service.sendMessage(
                    conversation.getId(), USER_ID, new TurnCommand("   ", null, null)))
        .isInstanceOf(RequestValidationException.class);
    verifyNoInteractions(messageStore, contextAssembler, generationProvider);
  }

  @Test
  void unknownConversationFailsTheTurn() {
    when(conversationService.requireOwned(conversation.getId(), USER_ID))
        .thenThrow(new ResourceNotFoundException("Conversation", conversation.getId()));

    assertThatThrownBy(
            () ->
                service.sendMessage(
                    conversation.getId(), USER_ID, new TurnCommand("Hello", null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(messageStore, never()).append(any());
  }

  @Test
  void streamMessageStartsGenerationOnConnectedClient() {
    givenAppendEchoes();
    List<PromptMessage> prompt = List.of(PromptMessage.user("Stream it"));
    StreamSession session = mock(StreamSession.class);
    when(streamingEngine.reserve("client-1", conversation.getId())).thenReturn(session);
    when(contextAssembler.assemble(conversation.getId(), "Stream it", null))
        .thenReturn(new AssembledContext(prompt, metadata));

    StreamTurnResult result =
        service.streamMessage(
            conversation.getId(), USER_ID, "client-1", new TurnCommand("Stream it", null, null));

    assertThat(result.session()).isSameAs(session);
    assertThat(result.userMessage().getRole()).isEqualTo(ChatRole.USER);
    ArgumentCaptor<StreamGenerationRequest> captor =
        ArgumentCaptor.forClass(StreamGenerationRequest.class);
    verify(streamingEngine).streamGeneration(eq(session), captor.capture());
    assertThat(captor.getValue().clientId()).isEqualTo("client-1");
    assertThat(captor.getValue().conversationId()).isEqualTo(conversation.getId());
    assertThat(captor.getValue().userId()).isEqualTo(USER_ID);
    assertThat(captor.getValue().messages()).isEqualTo(prompt);
    verify(streamingEngine, never()).release(any());
  }

  @Test
  void streamMessageRequiresConnectedClient() {
    when(streamingEngine.reserve("ghost", conversation.getId()))
        .thenThrow(new ResourceNotFoundException("Stream client", "ghost"));

    assertThatThrownBy(
            () ->
                service.streamMessage(
                    conversation.getId(), USER_ID, "ghost", new TurnCommand("Hi", null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(messageStore);
  }

  @Test
  void streamMessageToBusyClientStoresNothing() {
    when(streamingEngine.reserve("client-1", conversation.getId()))
        .thenThrow(new RequestValidationException("Client client-1 already has an active stream"));

    assertThatThrownBy(
            () ->
                service.streamMessage(
                    conversation.getId(), USER_ID, "client-1", new TurnCommand("Hi", null, null)))
        .isInstanceOf(RequestValidationException.class)
        .hasMessageContaining("already has an active stream");
    verifyNoInteractions(messageStore, contextAssembler);
  }

  @Test
  void streamMessageReleasesChannelWhenContextAssemblyFails() {
    givenAppendEchoes();
    StreamSession session = mock(StreamSession.class);
    when(streamingEngine.reserve("client-1", conversation.getId())).thenReturn(session);
    when(contextAssembler.assemble(conversation.getId(), "Hi", null))
        .thenThrow(new ResourceNotFoundException("Conversation", conversation.getId().toString()));

    assertThatThrownBy(
            () ->
                service.streamMessage(
                    conversation.getId(), USER_ID, "client-1", new TurnCommand("Hi", null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(streamingEngine).release(session);
    verify(streamingEngine, never()).streamGeneration(eq(session), any());
  }

  @Test
  void previewContextDoesNotPersist() {
    AssembledContext context = new AssembledContext(List.of(PromptMessage.user("q")), metadata);
    when(contextAssembler.assemble(conversation.getId(), "q", null)).thenReturn(context);

    assertThat(service.previewContext(conversation.getId(), USER_ID, "q", null)).isSameAs(context);
    verifyNoInteractions(messageStore, generationProvider);
  }

  private void givenAppendEchoes() {
    when(messageStore.append(any(NewMessage.class)))
        .thenAnswer(
            invocation -> {
              NewMessage newMessage = invocation.getArgument(0);
              ChatMessage message =
                  message(
                      conversation,
                      newMessage.role(),
                      newMessage.content(),
                      sequence.incrementAndGet());
              return message;
            });
  }
}
