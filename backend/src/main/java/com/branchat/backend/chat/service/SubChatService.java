package com.branchat.backend.chat.service;

import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.domain.SubChat;
import com.branchat.backend.chat.domain.SubChatMessage;
import com.branchat.backend.chat.persistence.SubChatMessageRepository;
import com.branchat.backend.chat.persistence.SubChatRepository;
import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.common.exception.RequestValidationException;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Lifecycle of sub-conversations up to the point where they are merged or cancelled. */
@Slf4j
@Service
public class SubChatService {

  static final String DEFAULT_TITLE = "New Sub-chat";
  static final int HISTORY_LIMIT = 20;

  private final ConversationService conversationService;
  private final SubChatRepository subChatRepository;
  private final SubChatMessageRepository subChatMessageRepository;
  private final GenerationProvider generationProvider;
  private final SubChatMessageWriter messageWriter;

  public SubChatService(
      ConversationService conversationService,
      SubChatRepository subChatRepository,
      SubChatMessageRepository subChatMessageRepository,
      GenerationProvider generationProvider,
      SubChatMessageWriter messageWriter) {
    this.conversationService =
        Objects.requireNonNull(conversationService, "conversationService must not be null");
    this.subChatRepository =
        Objects.requireNonNull(subChatRepository, "subChatRepository must not be null");
    this.subChatMessageRepository =
        Objects.requireNonNull(subChatMessageRepository, "subChatMessageRepository must not be null");
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.messageWriter = Objects.requireNonNull(messageWriter, "messageWriter must not be null");
  }

  /**
   * Opens a sub-conversation off the caller's conversation. Selected text becomes a leading system
   * message of the sub-conversation.
   */
  @Transactional
  public SubChat create(
      UUID conversationId,
      String userId,
      String title,
      String contextMessage,
      boolean includeInMemory) {
    Conversation parent = conversationService.requireOwned(conversationId, userId);
    String context = StringUtils.hasText(contextMessage) ? contextMessage.trim() : null;
    SubChat subChat =
        subChatRepository.save(
            new SubChat(
                parent,
                userId,
                StringUtils.hasText(title) ? title.trim() : DEFAULT_TITLE,
                context,
                includeInMemory));
    if (context != null) {
      messageWriter.append(
          subChat.getId(), ChatRole.SYSTEM, "Context from parent conversation: " + context);
    }
    log.info(
        "Sub-chat {} created in conversation {} (includeInMemory={})",
        subChat.getId(),
        conversationId,
        includeInMemory);
    return subChat;
  }

  @Transactional(readOnly = true)
  public SubChat requireOwned(UUID subChatId, String userId) {
    return subChatRepository
        .findById(subChatId)
        .filter(subChat -> Objects.equals(subChat.getUserId(), userId))
        .orElseThrow(() -> new ResourceNotFoundException("Sub-chat", subChatId));
  }

  @Transactional(readOnly = true)
  public List<SubChatMessage> messages(UUID subChatId, String userId) {
    requireOwned(subChatId, userId);
    return subChatMessageRepository.findBySubChat_IdOrderBySequenceNumberAsc(subChatId);
  }

  /**
   * Stores a user message and the model's answer, generated from the latest sub-conversation
   * history. A failed completion fails the call after the user message was stored.
   */
  public SubChatExchange addMessage(
      UUID subChatId, String userId, String content, GenerationOptions options) {
    if (!StringUtils.hasText(content)) {
      throw new RequestValidationException("Message content must not be blank");
    }
    SubChat subChat = requireOwned(subChatId, userId);
    if (!subChat.isOpen()) {
      throw new RequestValidationException(
          "Cannot add messages to a resolved or cancelled sub-chat");
    }
    SubChatMessage userMessage = messageWriter.append(subChatId, ChatRole.USER, content.trim());

    List<SubChatMessage> newestFirst =
        new ArrayList<>(
            subChatMessageRepository.findBySubChat_IdOrderBySequenceNumberDesc(
                subChatId, PageRequest.of(0, HISTORY_LIMIT)));
    Collections.reverse(newestFirst);
    List<PromptMessage> history =
        newestFirst.stream()
            .map(message -> new PromptMessage(message.getRole(), message.getContent()))
            .toList();

    String answer = generationProvider.complete(history, options);
    SubChatMessage assistantMessage = messageWriter.append(subChatId, ChatRole.ASSISTANT, answer);
    return new SubChatExchange(userMessage, assistantMessage);
  }

  @Transactional
  public SubChat cancel(UUID subChatId, String userId) {
    SubChat subChat =
        subChatRepository
            .findByIdForUpdate(subChatId)
            .filter(candidate -> Objects.equals(candidate.getUserId(), userId))
            .orElseThrow(() -> new ResourceNotFoundException("Sub-chat", subChatId));
    if (!subChat.isOpen()) {
      throw new RequestValidationException("Only active sub-chats can be cancelled");
    }
    subChat.cancel();
    log.info("Sub-chat {} cancelled", subChatId);
    return subChatRepository.save(subChat);
  }

  public record SubChatExchange(SubChatMessage userMessage, SubChatMessage assistantMessage) {}
}
