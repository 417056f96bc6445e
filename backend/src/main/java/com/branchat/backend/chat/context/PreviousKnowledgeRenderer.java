package com.branchat.backend.chat.context;

import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders short excerpts of a user's other conversations into a single system block. */
@Component
public class PreviousKnowledgeRenderer {

  /** Two question/answer pairs. */
  static final int MAX_EXCHANGE_MESSAGES = 4;

  static final int MAX_EXCERPT_LENGTH = 200;

  public ContextBlock render(List<ConversationExcerpt> excerpts) {
    if (excerpts == null || excerpts.isEmpty()) {
      return null;
    }
    List<String> sections = new ArrayList<>(excerpts.size());
    for (ConversationExcerpt excerpt : excerpts) {
      String exchanges =
          excerpt.messages().stream()
              .filter(message -> message.getRole() != ChatRole.SYSTEM && !message.isContextMarker())
              .limit(MAX_EXCHANGE_MESSAGES)
              .map(this::renderExchange)
              .collect(Collectors.joining("\n"));
      if (exchanges.isEmpty()) {
        continue;
      }
      Conversation conversation = excerpt.conversation();
      sections.add(
          "Previous Conversation: \""
              + conversation.getTitle()
              + "\"\nDate: "
              + formatDate(conversation.getUpdatedAt())
              + "\n"
              + exchanges);
    }
    if (sections.isEmpty()) {
      return null;
    }
    String content =
        "PREVIOUS KNOWLEDGE: You have access to "
            + sections.size()
            + " previous conversation(s):\n\n"
            + String.join("\n\n---\n\n", sections)
            + "\n\nUse this information to provide contextually aware responses.";
    return new ContextBlock(content, sections.size());
  }

  private String renderExchange(ChatMessage message) {
    String prefix = message.getRole() == ChatRole.USER ? "Q" : "A";
    String content = message.getContent();
    if (content.length() > MAX_EXCERPT_LENGTH) {
      content = content.substring(0, MAX_EXCERPT_LENGTH) + "...";
    }
    return prefix + ": " + content;
  }

  private String formatDate(Instant instant) {
    if (instant == null) {
      return "unknown";
    }
    return instant.atZone(ZoneOffset.UTC).toLocalDate().toString();
  }

  /**
   * A conversation with its latest messages in chronological order.
   */
  public record ConversationExcerpt(Conversation conversation, List<ChatMessage> messages) {

    public ConversationExcerpt {
      messages = messages != null ? List.copyOf(messages) : List.of();
    }
  }
}
