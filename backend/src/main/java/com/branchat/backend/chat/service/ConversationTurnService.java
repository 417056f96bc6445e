package com.branchat.backend.chat.service;

import com.branchat.backend.chat.context.AssembledContext;
import com.branchat.backend.chat.context.ContextAssembler;
import com.branchat.backend.chat.context.ContextOptions;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.chat.stream.StreamGenerationRequest;
import com.branchat.backend.chat.stream.StreamSession;
import com.branchat.backend.chat.stream.StreamingDeliveryEngine;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.common.exception.RequestValidationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs a user turn: persist the user message, assemble context, obtain the answer and persist it.
 * Failing to store the user message or to get any completion fails the turn; degraded context does
 * not.
 */
@Slf4j
@Service
public class ConversationTurnService {

  private final ConversationService conversationService;
  private final MessageStore messageStore;
  private final ContextAssembler contextAssembler;
  private final GenerationProvider generationProvider;
  private final StreamingDeliveryEngine streamingEngine;
  private final TokenEstimator tokenEstimator;
  private final Clock clock;

  @Autowired
  public ConversationTurnService(
      ConversationService conversationService,
      MessageStore messageStore,
      ContextAssembler contextAssembler,
      GenerationProvider generationProvider,
      StreamingDeliveryEngine streamingEngine,
      TokenEstimator tokenEstimator) {
    this(
        conversationService,
        messageStore,
        contextAssembler,
        generationProvider,
        streamingEngine,
        tokenEstimator,
        Clock.systemUTC());
  }

  ConversationTurnService(
      ConversationService conversationService,
      MessageStore messageStore,
      ContextAssembler contextAssembler,
      GenerationProvider generationProvider,
      StreamingDeliveryEngine streamingEngine,
      TokenEstimator tokenEstimator,
      Clock clock) {
    this.conversationService =
        Objects.requireNonNull(conversationService, "conversationService must not be null");
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.contextAssembler =
        Objects.requireNonNull(contextAssembler, "contextAssembler must not be null");
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.streamingEngine = Objects.requireNonNull(streamingEngine, "streamingEngine must not be null");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public TurnResult sendMessage(UUID conversationId, String userId, TurnCommand command) {
    String content = requireContent(command);
    conversationService.requireOwned(conversationId, userId);

    ChatMessage userMessage = appendUserMessage(conversationId, content);
    AssembledContext context =
        contextAssembler.assemble(conversationId, content, command.contextOptions());

    Instant started = clock.instant();
    String answer = generationProvider.complete(context.orderedMessages(), command.options());
    long processingTimeMs = Duration.between(started, clock.instant()).toMillis();

    ChatMessage assistantMessage =
        messageStore.append(
            NewMessage.of(conversationId, ChatRole.ASSISTANT, answer)
                .withMetadata(
                    tokenEstimator.estimate(answer), generationProvider.modelId(), processingTimeMs));
    log.info(
        "Turn completed in conversation {}: assistant message {} after {} ms",
        conversationId,
        assistantMessage.getId(),
        processingTimeMs);
    return new TurnResult(userMessage, assistantMessage, context.metadata());
  }

  /**
   * Claims the client's channel before persisting the user message, then streams the answer. A
   * client that is already streaming is rejected before anything is stored. The assistant message
   * is stored when the stream completes.
   */
  public StreamTurnResult streamMessage(
      UUID conversationId, String userId, String clientId, TurnCommand command) {
    String content = requireContent(command);
    conversationService.requireOwned(conversationId, userId);

    StreamSession session = streamingEngine.reserve(clientId, conversationId);
    try {
      ChatMessage userMessage = appendUserMessage(conversationId, content);
      AssembledContext context =
          contextAssembler.assemble(conversationId, content, command.contextOptions());
      streamingEngine.streamGeneration(
          session,
          new StreamGenerationRequest(
              clientId, conversationId, userId, context.orderedMessages(), command.options()));
      return new StreamTurnResult(userMessage, session, context.metadata());
    } catch (RuntimeException ex) {
      streamingEngine.release(session);
      throw ex;
    }
  }

  /** Assembles context for a query without persisting anything. */
  public AssembledContext previewContext(
      UUID conversationId, String userId, String query, ContextOptions options) {
    conversationService.requireOwned(conversationId, userId);
    return contextAssembler.assemble(conversationId, query, options);
  }

  private ChatMessage appendUserMessage(UUID conversationId, String content) {
    try {
      return messageStore.append(NewMessage.of(conversationId, ChatRole.USER, content));
    } catch (RuntimeException ex) {
      log.error("Failed to store user message in conversation {}", conversationId, ex);
      throw ex;
    }
  }

  private String requireContent(TurnCommand command) {
    Objects.requireNonNull(command, "command must not be null");
    if (!StringUtils.hasText(command.content())) {
      throw new RequestValidationException("Message content must not be blank");
    }
    return command.content().trim();
  }
}
