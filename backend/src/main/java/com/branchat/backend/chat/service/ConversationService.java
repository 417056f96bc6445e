package com.branchat.backend.chat.service;

import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.persistence.ConversationRepository;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.NewMessage;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import com.branchat.backend.memory.model.MemorySearchResult;
import com.branchat.backend.memory.service.MemoryService;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
public class ConversationService {

  static final String DEFAULT_TITLE = "New Conversation";
  static final int TITLE_LENGTH = 50;

  private final ConversationRepository conversationRepository;
  private final MessageStore messageStore;
  private final ChatUserService chatUserService;
  private final MemoryService memoryService;

  public ConversationService(
      ConversationRepository conversationRepository,
      MessageStore messageStore,
      ChatUserService chatUserService,
      MemoryService memoryService) {
    this.conversationRepository =
        Objects.requireNonNull(conversationRepository, "conversationRepository must not be null");
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore must not be null");
    this.chatUserService = Objects.requireNonNull(chatUserService, "chatUserService must not be null");
    this.memoryService = Objects.requireNonNull(memoryService, "memoryService must not be null");
  }

  /** Loads a conversation owned by the caller. Conversations of other users are reported missing. */
  public Conversation requireOwned(UUID conversationId, String userId) {
    return messageStore
        .findConversation(conversationId)
        .filter(conversation -> Objects.equals(conversation.getUserId(), userId))
        .orElseThrow(() -> new ResourceNotFoundException("Conversation", conversationId));
  }

  /**
   * Creates a conversation. With {@code useMemory} and an opted-in user, memories relevant to the
   * initial message are written as a leading system note; a failing memory lookup only drops the
   * note.
   */
  public StartedConversation start(
      String userId, String title, boolean useMemory, String initialMessage) {
    chatUserService.ensureUser(userId);
    String effectiveTitle = resolveTitle(title, initialMessage);
    Conversation conversation = conversationRepository.save(new Conversation(userId, effectiveTitle));

    int memoriesUsed = 0;
    if (useMemory && StringUtils.hasText(initialMessage)) {
      memoriesUsed = addMemoryNote(conversation, userId, initialMessage.trim());
    }

    UUID userMessageId = null;
    if (StringUtils.hasText(initialMessage)) {
      ChatMessage userMessage =
          messageStore.append(
              NewMessage.of(conversation.getId(), ChatRole.USER, initialMessage.trim()));
      userMessageId = userMessage.getId();
    }
    log.info(
        "Conversation {} started for user {} (memoriesUsed={})",
        conversation.getId(),
        userId,
        memoriesUsed);
    Conversation current = messageStore.findConversation(conversation.getId()).orElse(conversation);
    return new StartedConversation(current, userMessageId, memoriesUsed);
  }

  private int addMemoryNote(Conversation conversation, String userId, String query) {
    if (!chatUserService.isMemoryOptedIn(userId) || !memoryService.isAvailable()) {
      return 0;
    }
    List<MemorySearchResult> memories;
    try {
      memories = memoryService.getRelevantMemories(query, userId, conversation.getId(), null);
    } catch (RuntimeException ex) {
      log.warn(
          "Failed to retrieve memories for new conversation {}: {}",
          conversation.getId(),
          ex.getMessage());
      return 0;
    }
    if (memories.isEmpty()) {
      return 0;
    }
    String notes =
        IntStream.range(0, memories.size())
            .mapToObj(index -> (index + 1) + ". " + memories.get(index).summary())
            .collect(Collectors.joining("\n"));
    String content =
        "Based on your past conversations, here are some relevant notes:\n\n"
            + notes
            + "\n\nPlease use this context to provide more personalized and informed responses.";
    messageStore.append(NewMessage.of(conversation.getId(), ChatRole.SYSTEM, content));
    return memories.size();
  }

  private String resolveTitle(String title, String initialMessage) {
    if (StringUtils.hasText(title)) {
      return title.trim();
    }
    if (!StringUtils.hasText(initialMessage)) {
      return DEFAULT_TITLE;
    }
    String trimmed = initialMessage.trim();
    return trimmed.length() > TITLE_LENGTH ? trimmed.substring(0, TITLE_LENGTH) + "..." : trimmed;
  }

  public record StartedConversation(
      Conversation conversation, UUID userMessageId, int memoriesUsed) {}
}
