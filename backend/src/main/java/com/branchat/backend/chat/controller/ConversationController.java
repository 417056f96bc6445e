package com.branchat.backend.chat.controller;

import com.branchat.backend.chat.api.ContextPreviewRequest;
import com.branchat.backend.chat.api.ContextPreviewResponse;
import com.branchat.backend.chat.api.ContextRequestOptions;
import com.branchat.backend.chat.api.ConversationResponse;
import com.branchat.backend.chat.api.CreateSubChatRequest;
import com.branchat.backend.chat.api.GenerationRequestOptions;
import com.branchat.backend.chat.api.MessageResponse;
import com.branchat.backend.chat.api.SendMessageRequest;
import com.branchat.backend.chat.api.SendMessageResponse;
import com.branchat.backend.chat.api.StartConversationRequest;
import com.branchat.backend.chat.api.StartConversationResponse;
import com.branchat.backend.chat.api.StreamMessageRequest;
import com.branchat.backend.chat.api.StreamMessageResponse;
import com.branchat.backend.chat.api.SubChatResponse;
import com.branchat.backend.chat.config.ChatContextProperties;
import com.branchat.backend.chat.context.AssembledContext;
import com.branchat.backend.chat.context.ContextOptions;
import com.branchat.backend.chat.embedding.BackfillResult;
import com.branchat.backend.chat.embedding.MessageEmbeddingQueue;
import com.branchat.backend.chat.service.ConversationService;
import com.branchat.backend.chat.service.ConversationTurnService;
import com.branchat.backend.chat.service.StreamTurnResult;
import com.branchat.backend.chat.service.SubChatService;
import com.branchat.backend.chat.service.TurnCommand;
import com.branchat.backend.chat.service.TurnResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
@Validated
@Tag(name = "Conversations", description = "Conversation turns, context preview and branching.")
public class ConversationController {

  static final String USER_HEADER = "X-User-Id";

  private final ConversationService conversationService;
  private final ConversationTurnService turnService;
  private final SubChatService subChatService;
  private final MessageEmbeddingQueue embeddingQueue;
  private final ChatContextProperties contextProperties;

  public ConversationController(
      ConversationService conversationService,
      ConversationTurnService turnService,
      SubChatService subChatService,
      MessageEmbeddingQueue embeddingQueue,
      ChatContextProperties contextProperties) {
    this.conversationService = conversationService;
    this.turnService = turnService;
    this.subChatService = subChatService;
    this.embeddingQueue = embeddingQueue;
    this.contextProperties = contextProperties;
  }

  @PostMapping(
      value = "/start",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Start a conversation, optionally seeded with relevant memories.")
  public ResponseEntity<StartConversationResponse> start(
      @RequestHeader(USER_HEADER) String userId,
      @RequestBody @Valid StartConversationRequest request) {
    ConversationService.StartedConversation started =
        conversationService.start(
            userId,
            request.title(),
            Boolean.TRUE.equals(request.useMemory()),
            request.initialMessage());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new StartConversationResponse(
                ConversationResponse.from(started.conversation()),
                started.userMessageId(),
                started.memoriesUsed()));
  }

  @PostMapping(
      value = "/{conversationId}/messages",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Send a message and wait for the answer.",
      description =
          "Stores the message, assembles a bounded context from recent, similar, merged sub-chat and earlier conversation messages, and stores the generated answer.")
  public SendMessageResponse sendMessage(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable UUID conversationId,
      @RequestBody @Valid SendMessageRequest request) {
    TurnResult result =
        turnService.sendMessage(
            conversationId,
            userId,
            new TurnCommand(
                request.content(),
                contextOptions(request.context()),
                GenerationRequestOptions.toOptions(request.options())));
    return new SendMessageResponse(
        MessageResponse.from(result.userMessage()),
        MessageResponse.from(result.assistantMessage()),
        result.context());
  }

  @PostMapping(
      value = "/{conversationId}/messages/stream",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Send a message and stream the answer over the client's event channel.",
      description = "The client must be connected through /api/stream/connect first.")
  public ResponseEntity<StreamMessageResponse> streamMessage(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable UUID conversationId,
      @RequestBody @Valid StreamMessageRequest request) {
    StreamTurnResult result =
        turnService.streamMessage(
            conversationId,
            userId,
            request.clientId(),
            new TurnCommand(
                request.content(),
                contextOptions(request.context()),
                GenerationRequestOptions.toOptions(request.options())));
    return ResponseEntity.accepted()
        .body(
            new StreamMessageResponse(
                request.clientId(),
                result.session().getId(),
                MessageResponse.from(result.userMessage()),
                result.context()));
  }

  @PostMapping(
      value = "/{conversationId}/context/preview",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Show the context that would be sent to the model for a query.")
  public ContextPreviewResponse previewContext(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable UUID conversationId,
      @RequestBody @Valid ContextPreviewRequest request) {
    AssembledContext context =
        turnService.previewContext(
            conversationId, userId, request.query(), contextOptions(request.context()));
    return new ContextPreviewResponse(context.orderedMessages(), context.metadata());
  }

  @PostMapping(value = "/{conversationId}/embeddings/backfill")
  @Operation(summary = "Embed the conversation messages that have no embedding yet.")
  public BackfillResult backfillEmbeddings(
      @RequestHeader(USER_HEADER) String userId, @PathVariable UUID conversationId) {
    conversationService.requireOwned(conversationId, userId);
    return embeddingQueue.backfill(conversationId);
  }

  @PostMapping(
      value = "/{conversationId}/subchats",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Branch a sub-chat off the conversation.")
  public ResponseEntity<SubChatResponse> createSubChat(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable UUID conversationId,
      @RequestBody @Valid CreateSubChatRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            SubChatResponse.from(
                subChatService.create(
                    conversationId,
                    userId,
                    request.title(),
                    request.contextMessage(),
                    !Boolean.FALSE.equals(request.includeInMemory()))));
  }

  private ContextOptions contextOptions(ContextRequestOptions overrides) {
    return overrides != null
        ? ContextRequestOptions.merge(overrides, ContextOptions.defaults(contextProperties))
        : null;
  }
}
