package com.branchat.backend.chat.merge;

import com.branchat.backend.chat.config.ChatMergeProperties;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.ChatUser;
import com.branchat.backend.chat.domain.SubChat;
import com.branchat.backend.chat.domain.SubChatMessage;
import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import com.branchat.backend.chat.persistence.ChatUserRepository;
import com.branchat.backend.chat.persistence.SubChatMessageRepository;
import com.branchat.backend.chat.persistence.SubChatRepository;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.branchat.backend.chat.provider.model.StructuredSummaryOutcome;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import com.branchat.backend.memory.service.MemoryService;
import com.branchat.backend.shared.text.KeywordExtractor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Folds a finished sub-conversation back into its parent: summarise the transcript, resolve the
 * sub-conversation, inject the summary into the parent log, then optionally record a context
 * marker and a long-term memory entry.
 *
 * <p>The steps are applied one after another without a surrounding transaction. The status is
 * checked again under a row lock right before resolving, so of two concurrent merges only one
 * injects a summary. Once the sub-conversation is resolved it stays resolved even if a later step
 * fails. Marker and memory
 * writes are best effort and never fail the merge.
 */
@Service
public class SubChatMergeService {

  private static final Logger log = LoggerFactory.getLogger(SubChatMergeService.class);

  private final SubChatRepository subChatRepository;
  private final SubChatResolver subChatResolver;
  private final SubChatMessageRepository subChatMessageRepository;
  private final ChatUserRepository chatUserRepository;
  private final MessageStore messageStore;
  private final GenerationProvider generationProvider;
  private final MemoryService memoryService;
  private final TranscriptRenderer transcriptRenderer;
  private final SummaryInjectionFormatter injectionFormatter;
  private final TokenEstimator tokenEstimator;
  private final ChatMergeProperties properties;
  private final Clock clock;
  private final Counter mergeCounter;
  private final Counter degradedSummaryCounter;

  @Autowired
  public SubChatMergeService(
      SubChatRepository subChatRepository,
      SubChatResolver subChatResolver,
      SubChatMessageRepository subChatMessageRepository,
      ChatUserRepository chatUserRepository,
      MessageStore messageStore,
      GenerationProvider generationProvider,
      MemoryService memoryService,
      TranscriptRenderer transcriptRenderer,
      SummaryInjectionFormatter injectionFormatter,
      TokenEstimator tokenEstimator,
      ChatMergeProperties properties,
      MeterRegistry meterRegistry) {
    this(
        subChatRepository,
        subChatResolver,
        subChatMessageRepository,
        chatUserRepository,
        messageStore,
        generationProvider,
        memoryService,
        transcriptRenderer,
        injectionFormatter,
        tokenEstimator,
        properties,
        meterRegistry,
        Clock.systemUTC());
  }

  SubChatMergeService(
      SubChatRepository subChatRepository,
      SubChatResolver subChatResolver,
      SubChatMessageRepository subChatMessageRepository,
      ChatUserRepository chatUserRepository,
      MessageStore messageStore,
      GenerationProvider generationProvider,
      MemoryService memoryService,
      TranscriptRenderer transcriptRenderer,
      SummaryInjectionFormatter injectionFormatter,
      TokenEstimator tokenEstimator,
      ChatMergeProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.subChatRepository =
        Objects.requireNonNull(subChatRepository, "subChatRepository must not be null");
    this.subChatResolver =
        Objects.requireNonNull(subChatResolver, "subChatResolver must not be null");
    this.subChatMessageRepository =
        Objects.requireNonNull(subChatMessageRepository, "subChatMessageRepository must not be null");
    this.chatUserRepository =
        Objects.requireNonNull(chatUserRepository, "chatUserRepository must not be null");
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.memoryService = Objects.requireNonNull(memoryService, "memoryService must not be null");
    this.transcriptRenderer =
        Objects.requireNonNull(transcriptRenderer, "transcriptRenderer must not be null");
    this.injectionFormatter =
        Objects.requireNonNull(injectionFormatter, "injectionFormatter must not be null");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.mergeCounter = meterRegistry != null ? meterRegistry.counter("subchat_merges_total") : null;
    this.degradedSummaryCounter =
        meterRegistry != null ? meterRegistry.counter("subchat_merge_degraded_summaries_total") : null;
  }

  /**
   * Merges the caller's sub-conversation into its parent.
   *
   * @throws ResourceNotFoundException if the sub-conversation does not exist or belongs to another
   *     user
   * @throws SubChatMergeRejectedException if it is not open or has no messages
   * @throws com.branchat.backend.chat.provider.GenerationUnavailableException if no summary
   *     response could be obtained
   */
  public MergeResult merge(UUID subChatId, String userId) {
    Objects.requireNonNull(subChatId, "subChatId must not be null");
    SubChat subChat =
        subChatRepository
            .findById(subChatId)
            .filter(candidate -> Objects.equals(candidate.getUserId(), userId))
            .orElseThrow(() -> new ResourceNotFoundException("Sub-chat", subChatId));
    SubChatResolver.rejectUnlessOpen(subChat);

    List<SubChatMessage> messages =
        subChatMessageRepository.findBySubChat_IdOrderBySequenceNumberAsc(subChatId);
    String transcript = transcriptRenderer.render(messages);
    if (!StringUtils.hasText(transcript)) {
      throw new SubChatMergeRejectedException(MergeRejection.EMPTY_TRANSCRIPT, subChatId);
    }
    log.info(
        "Merging sub-chat {} ({} message(s), transcript {} chars)",
        subChatId,
        messages.size(),
        transcript.length());

    StructuredSummaryOutcome outcome = generationProvider.summarizeStructured(transcript);
    boolean degraded = !outcome.isParsed();
    StructuredSummary summary = degraded ? fallbackSummary(outcome.rawResponse()) : outcome.summary();
    if (degraded) {
      increment(degradedSummaryCounter);
      log.warn(
          "Using heuristic summary for sub-chat {}: {}", subChatId, outcome.failureReason());
    }

    Instant resolvedAt = clock.instant();
    subChat = subChatResolver.resolve(subChatId, summary.summary(), resolvedAt);
    log.info("Sub-chat {} resolved", subChatId);

    UUID conversationId = subChat.getParentConversation().getId();
    String injectedContent = injectionFormatter.format(summary);
    ChatMessage injected =
        messageStore.append(
            NewMessage.of(conversationId, ChatRole.ASSISTANT, injectedContent)
                .withMetadata(tokenEstimator.estimate(injectedContent), null, null)
                .fromSubChat(subChatId));
    log.info(
        "Injected summary of sub-chat {} into conversation {} as message {}",
        subChatId,
        conversationId,
        injected.getId());

    UUID markerId = recordContextMarker(subChat, conversationId, summary, messages, resolvedAt);
    boolean memoryStored = storeMemory(subChat, conversationId, userId, summary, resolvedAt);

    increment(mergeCounter);
    log.info("Sub-chat {} merge completed (memoryStored={})", subChatId, memoryStored);
    return new MergeResult(
        subChatId,
        conversationId,
        subChat.getStatus(),
        resolvedAt,
        summary,
        degraded,
        injected.getId(),
        injected.getContent(),
        injected.getCreatedAt(),
        markerId,
        memoryStored);
  }

  StructuredSummary fallbackSummary(String rawResponse) {
    String raw = rawResponse != null ? rawResponse : "";
    int length = Math.min(raw.length(), Math.max(0, properties.getFallbackSummaryLength()));
    return new StructuredSummary(
        raw.substring(0, length),
        List.of(),
        List.of(),
        KeywordExtractor.extract(raw, properties.getFallbackKeywordLimit()));
  }

  private UUID recordContextMarker(
      SubChat subChat,
      UUID conversationId,
      StructuredSummary summary,
      List<SubChatMessage> messages,
      Instant mergedAt) {
    if (!properties.isRecordContextMarker()) {
      return null;
    }
    int questionCount =
        (int) messages.stream().filter(message -> message.getRole() == ChatRole.USER).count();
    SubChatSummaryMarker marker =
        new SubChatSummaryMarker(
            subChat.getId(),
            subChat.getContextMessage(),
            summary.summary(),
            injectionFormatter.format(summary),
            questionCount,
            mergedAt);
    String label =
        StringUtils.hasText(subChat.getTitle()) ? subChat.getTitle() : "sub-chat " + subChat.getId();
    try {
      ChatMessage saved =
          messageStore.append(
              NewMessage.of(conversationId, ChatRole.SYSTEM, "Context recorded from " + label)
                  .fromSubChat(subChat.getId())
                  .withSummaryMarker(marker));
      return saved.getId();
    } catch (RuntimeException ex) {
      log.warn("Failed to record context marker for sub-chat {}", subChat.getId(), ex);
      return null;
    }
  }

  private boolean storeMemory(
      SubChat subChat,
      UUID conversationId,
      String userId,
      StructuredSummary summary,
      Instant mergedAt) {
    if (!subChat.isIncludeInMemory()) {
      return false;
    }
    try {
      Optional<ChatUser> user = chatUserRepository.findById(userId);
      if (user.isEmpty() || !user.get().isMemoryOptIn() || !memoryService.isAvailable()) {
        log.info(
            "Memory storage skipped for sub-chat {} (userOptIn={}, memoryAvailable={})",
            subChat.getId(),
            user.map(ChatUser::isMemoryOptIn).orElse(null),
            memoryService.isAvailable());
        return false;
      }
      return memoryService.storeMemory(
          subChat.getId(), conversationId, userId, summary, subChat.getCreatedAt(), mergedAt);
    } catch (RuntimeException ex) {
      log.warn("Failed to store sub-chat {} in memory, continuing with merge", subChat.getId(), ex);
      return false;
    }
  }

  private static void increment(Counter counter) {
    if (counter != null) {
      counter.increment();
    }
  }
}
