package com.branchat.backend.chat.store;

import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.Conversation;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only message log of conversations. Reads always observe the latest committed state.
 */
public interface MessageStore {

  Optional<Conversation> findConversation(UUID conversationId);

  /** The latest {@code limit} messages in chronological order. */
  List<ChatMessage> findRecent(UUID conversationId, int limit);

  /**
   * Indexed messages whose cosine similarity to the embedding of {@code queryText} is at least
   * {@code threshold}, best match first. The query embedding is not stored.
   */
  List<ScoredMessage> findSimilar(UUID conversationId, String queryText, int topK, double threshold);

  /** Appends a message with the next sequence number of its conversation. */
  ChatMessage append(NewMessage message);

  /** The latest context markers of a conversation, newest first. */
  List<ChatMessage> findRecentContextMarkers(UUID conversationId, int limit);

  /** Other conversations of the same user, most recently updated first. */
  List<Conversation> findOtherConversations(String userId, UUID excludedConversationId, int limit);

  Optional<ChatMessage> findMessage(UUID messageId);

  /** Non-system messages that still lack an embedding, oldest first. */
  List<ChatMessage> findWithoutEmbedding(UUID conversationId, int limit);

  /** Embeds the message into the message vector store and marks it as indexed. */
  void indexEmbedding(UUID messageId);
}
