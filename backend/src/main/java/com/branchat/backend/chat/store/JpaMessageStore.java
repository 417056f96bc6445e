package com.branchat.backend.chat.store;

import com.branchat.backend.chat.config.ChatVectorStoreConfiguration;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.persistence.ChatMessageRepository;
import com.branchat.backend.chat.persistence.ConversationRepository;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class JpaMessageStore implements MessageStore {

  static final String CONVERSATION_ID_KEY = "conversation_id";
  static final String ROLE_KEY = "role";

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final VectorStore vectorStore;
  private final ApplicationEventPublisher eventPublisher;

  public JpaMessageStore(
      ConversationRepository conversationRepository,
      ChatMessageRepository chatMessageRepository,
      @Qualifier(ChatVectorStoreConfiguration.MESSAGE_VECTOR_STORE) VectorStore vectorStore,
      ApplicationEventPublisher eventPublisher) {
    this.conversationRepository = conversationRepository;
    this.chatMessageRepository = chatMessageRepository;
    this.vectorStore = vectorStore;
    this.eventPublisher = eventPublisher;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> findConversation(UUID conversationId) {
    return conversationRepository.findById(conversationId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> findRecent(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<ChatMessage> newestFirst =
        new ArrayList<>(
            chatMessageRepository.findByConversation_IdOrderBySequenceNumberDesc(
                conversationId, PageRequest.of(0, limit)));
    Collections.reverse(newestFirst);
    return newestFirst;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ScoredMessage> findSimilar(
      UUID conversationId, String queryText, int topK, double threshold) {
    if (!StringUtils.hasText(queryText) || topK <= 0) {
      return List.of();
    }
    FilterExpressionBuilder builder = new FilterExpressionBuilder();
    SearchRequest request =
        SearchRequest.builder()
            .query(queryText)
            .topK(topK)
            .similarityThreshold(threshold)
            .filterExpression(builder.eq(CONVERSATION_ID_KEY, conversationId.toString()).build())
            .build();
    List<Document> documents = vectorStore.similaritySearch(request);
    if (documents.isEmpty()) {
      return List.of();
    }

    List<UUID> messageIds =
        documents.stream().map(document -> UUID.fromString(document.getId())).toList();
    Map<UUID, ChatMessage> messagesById =
        chatMessageRepository.findAllById(messageIds).stream()
            .collect(Collectors.toMap(ChatMessage::getId, Function.identity()));

    List<ScoredMessage> similar = new ArrayList<>(documents.size());
    for (Document document : documents) {
      ChatMessage message = messagesById.get(UUID.fromString(document.getId()));
      if (message != null) {
        similar.add(
            new ScoredMessage(message, document.getScore() != null ? document.getScore() : 0.0d));
      }
    }
    return similar;
  }

  @Override
  @Transactional
  public ChatMessage append(NewMessage message) {
    Conversation conversation =
        conversationRepository
            .findByIdForUpdate(message.conversationId())
            .orElseThrow(
                () -> new ResourceNotFoundException("Conversation", message.conversationId()));

    int nextSequence =
        chatMessageRepository
                .findTopByConversation_IdOrderBySequenceNumberDesc(conversation.getId())
                .map(ChatMessage::getSequenceNumber)
                .orElse(0)
            + 1;

    ChatMessage entity =
        new ChatMessage(conversation, message.role(), message.content(), nextSequence);
    entity.applyMetadata(message.tokens(), message.model(), message.processingTimeMs());
    entity.setSourceSubChatId(message.sourceSubChatId());
    entity.setSummaryMarker(message.summaryMarker());
    ChatMessage saved = chatMessageRepository.save(entity);

    conversation.recordMessage(saved.getCreatedAt());
    conversationRepository.save(conversation);

    eventPublisher.publishEvent(
        new MessageAppendedEvent(
            conversation.getId(), saved.getId(), saved.getRole(), saved.getContent().length()));
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> findRecentContextMarkers(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return chatMessageRepository
        .findByConversation_IdAndSummaryMarkerIsNotNullOrderBySequenceNumberDesc(
            conversationId, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Conversation> findOtherConversations(
      String userId, UUID excludedConversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return conversationRepository.findByUserIdAndIdNotOrderByUpdatedAtDesc(
        userId, excludedConversationId, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ChatMessage> findMessage(UUID messageId) {
    return chatMessageRepository.findById(messageId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> findWithoutEmbedding(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return chatMessageRepository
        .findByConversation_IdAndVectorIndexedFalseAndRoleNotOrderBySequenceNumberAsc(
            conversationId, ChatRole.SYSTEM, PageRequest.of(0, limit));
  }

  @Override
  @Transactional
  public void indexEmbedding(UUID messageId) {
    ChatMessage message =
        chatMessageRepository
            .findById(messageId)
            .orElseThrow(() -> new ResourceNotFoundException("Message", messageId));
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(CONVERSATION_ID_KEY, message.getConversation().getId().toString());
    metadata.put(ROLE_KEY, message.getRole().name());
    vectorStore.add(
        List.of(
            Document.builder()
                .id(message.getId().toString())
                .text(message.getContent())
                .metadata(metadata)
                .build()));
    message.markVectorIndexed();
    chatMessageRepository.save(message);
  }
}
