package com.branchat.backend.chat.context;

import com.branchat.backend.chat.config.ChatContextProperties;
import com.branchat.backend.chat.context.PreviousKnowledgeRenderer.ConversationExcerpt;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.ScoredMessage;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Builds the ordered message list sent to the model under a token budget. Sources are evaluated in
 * a fixed order and each one is gated by the running estimate:
 *
 * <ol>
 *   <li>latest messages, always included;
 *   <li>messages similar to the query, attempted below 50% of the budget and added until 60%;
 *   <li>merged sub-conversation summaries, attempted below 70% and kept if the result stays below
 *       80%;
 *   <li>excerpts of other conversations of the same user, attempted below 85% and kept if the
 *       result stays below 95%.
 * </ol>
 *
 * Failures of the optional sources are logged and the source is skipped.
 */
@Service
public class ContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

  /** Messages fetched per previous conversation before system messages are dropped. */
  private static final int PREVIOUS_CONVERSATION_FETCH = 5;

  private final MessageStore messageStore;
  private final TokenEstimator tokenEstimator;
  private final SubChatContextRenderer subChatContextRenderer;
  private final PreviousKnowledgeRenderer previousKnowledgeRenderer;
  private final ChatContextProperties properties;

  public ContextAssembler(
      MessageStore messageStore,
      TokenEstimator tokenEstimator,
      SubChatContextRenderer subChatContextRenderer,
      PreviousKnowledgeRenderer previousKnowledgeRenderer,
      ChatContextProperties properties) {
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    this.subChatContextRenderer =
        Objects.requireNonNull(subChatContextRenderer, "subChatContextRenderer must not be null");
    this.previousKnowledgeRenderer =
        Objects.requireNonNull(previousKnowledgeRenderer, "previousKnowledgeRenderer must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  public AssembledContext assemble(UUID conversationId, String queryText) {
    return assemble(conversationId, queryText, ContextOptions.defaults(properties));
  }

  public AssembledContext assemble(UUID conversationId, String queryText, ContextOptions options) {
    Objects.requireNonNull(conversationId, "conversationId must not be null");
    ContextOptions effective = options != null ? options : ContextOptions.defaults(properties);
    Conversation conversation =
        messageStore
            .findConversation(conversationId)
            .orElseThrow(() -> new ResourceNotFoundException("Conversation", conversationId));

    ContextBudget budget = new ContextBudget(effective.maxTokens());
    List<PromptMessage> ordered = new ArrayList<>();

    List<ChatMessage> recent = messageStore.findRecent(conversationId, effective.recentMessageCount());
    int recentCount = addRecentMessages(recent, ordered, budget);

    int semanticCount = 0;
    if (effective.enableSemantic() && budget.isBelow(ContextBudget.SEMANTIC_ATTEMPT)) {
      semanticCount = addSimilarMessages(conversationId, queryText, recent, ordered, budget);
    }

    int subChatCount = 0;
    if (effective.enableSubchatSummaries() && budget.isBelow(ContextBudget.SUBCHAT_ATTEMPT)) {
      subChatCount = addSubChatSummaries(conversationId, ordered, budget);
    }

    int previousCount = 0;
    if (effective.enablePreviousKnowledge() && budget.isBelow(ContextBudget.PREVIOUS_ATTEMPT)) {
      previousCount = addPreviousKnowledge(conversation, ordered, budget);
    }

    if (effective.enableDocuments()) {
      log.debug("Document context requested for conversation {} but no document source is configured", conversationId);
    }

    ContextMetadata metadata =
        new ContextMetadata(
            recentCount,
            semanticCount,
            subChatCount,
            previousCount,
            budget.estimatedTokens(),
            budget.maxTokens(),
            budget.isExhausted());
    log.info(
        "Assembled context for conversation {}: recent={}, semantic={}, subChats={}, previous={}, tokens={}/{}",
        conversationId,
        recentCount,
        semanticCount,
        subChatCount,
        previousCount,
        metadata.estimatedTokens(),
        metadata.maxTokens());
    return new AssembledContext(ordered, metadata);
  }

  private int addRecentMessages(
      List<ChatMessage> recent, List<PromptMessage> ordered, ContextBudget budget) {
    int added = 0;
    for (ChatMessage message : recent) {
      if (message.isContextMarker()) {
        continue;
      }
      ordered.add(new PromptMessage(message.getRole(), message.getContent()));
      budget.add(tokenEstimator.estimate(message.getContent()));
      added++;
    }
    return added;
  }

  private int addSimilarMessages(
      UUID conversationId,
      String queryText,
      List<ChatMessage> recent,
      List<PromptMessage> ordered,
      ContextBudget budget) {
    if (!StringUtils.hasText(queryText)) {
      return 0;
    }
    List<ScoredMessage> similar;
    try {
      similar =
          messageStore.findSimilar(
              conversationId,
              queryText,
              properties.getSemanticSearchResults(),
              properties.getSemanticThreshold());
    } catch (RuntimeException exception) {
      log.warn(
          "Semantic context skipped for conversation {}: {}", conversationId, exception.getMessage());
      return 0;
    }

    Set<UUID> recentIds = new HashSet<>();
    recent.forEach(message -> recentIds.add(message.getId()));

    int added = 0;
    for (ScoredMessage candidate : similar) {
      if (!budget.isBelow(ContextBudget.SEMANTIC_STOP)) {
        break;
      }
      ChatMessage message = candidate.message();
      if (recentIds.contains(message.getId()) || message.isContextMarker()) {
        continue;
      }
      ordered.add(new PromptMessage(message.getRole(), message.getContent()));
      budget.add(tokenEstimator.estimate(message.getContent()));
      added++;
    }
    return added;
  }

  private int addSubChatSummaries(
      UUID conversationId, List<PromptMessage> ordered, ContextBudget budget) {
    try {
      List<SubChatSummaryMarker> markers =
          messageStore.findRecentContextMarkers(conversationId, properties.getSubChatHistories()).stream()
              .map(ChatMessage::getSummaryMarker)
              .filter(Objects::nonNull)
              .toList();
      ContextBlock block = subChatContextRenderer.render(markers);
      if (block == null) {
        return 0;
      }
      int tokens = tokenEstimator.estimate(block.content());
      if (!budget.fitsBelow(tokens, ContextBudget.SUBCHAT_KEEP)) {
        log.debug(
            "Sub-conversation context for {} dropped: {} tokens do not fit the budget",
            conversationId,
            tokens);
        return 0;
      }
      ordered.add(PromptMessage.system(block.content()));
      budget.add(tokens);
      return block.sourceCount();
    } catch (RuntimeException exception) {
      log.warn(
          "Sub-conversation context skipped for conversation {}: {}",
          conversationId,
          exception.getMessage());
      return 0;
    }
  }

  private int addPreviousKnowledge(
      Conversation conversation, List<PromptMessage> ordered, ContextBudget budget) {
    try {
      List<ConversationExcerpt> excerpts = new ArrayList<>();
      for (Conversation other :
          messageStore.findOtherConversations(
              conversation.getUserId(), conversation.getId(), properties.getPreviousConversations())) {
        List<ChatMessage> messages = messageStore.findRecent(other.getId(), PREVIOUS_CONVERSATION_FETCH);
        if (!messages.isEmpty()) {
          excerpts.add(new ConversationExcerpt(other, messages));
        }
      }
      ContextBlock block = previousKnowledgeRenderer.render(excerpts);
      if (block == null) {
        return 0;
      }
      int tokens = tokenEstimator.estimate(block.content());
      if (!budget.fitsBelow(tokens, ContextBudget.PREVIOUS_KEEP)) {
        log.debug(
            "Previous knowledge for {} dropped: {} tokens do not fit the budget",
            conversation.getId(),
            tokens);
        return 0;
      }
      ordered.add(PromptMessage.system(block.content()));
      budget.add(tokens);
      return block.sourceCount();
    } catch (RuntimeException exception) {
      log.warn(
          "Previous knowledge skipped for conversation {}: {}",
          conversation.getId(),
          exception.getMessage());
      return 0;
    }
  }
}
