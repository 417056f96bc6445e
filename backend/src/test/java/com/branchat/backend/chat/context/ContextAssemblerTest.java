package com.branchat.backend.chat.context;

import static com.branchat.backend.chat.TestChatDataFactory.contextMarker;
import static com.branchat.backend.chat.TestChatDataFactory.conversation;
import static com.branchat.backend.chat.TestChatDataFactory.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.branchat.backend.chat.config.ChatContextProperties;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import com.branchat.backend.chat.provider.GenerationUnavailableException;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.store.MessageStore;
import com.branchat.backend.chat.store.ScoredMessage;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContextAssemblerTest {

  private static final UUID CONVERSATION_ID = UUID.randomUUID();
  private static final String USER_ID = "user-1";

  @Mock private MessageStore messageStore;

  private Conversation conversation;
  private ContextAssembler assembler;

  @BeforeEach
  void setUp() {
    conversation = conversation(CONVERSATION_ID, USER_ID, "Current");
    assembler =
        new ContextAssembler(
            messageStore,
            String::length,
            new SubChatContextRenderer(),
            new PreviousKnowledgeRenderer(),
            new ChatContextProperties());
  }

  @Test
  void ordersSourcesRecentSemanticSubChatsThenPreviousConversations() {
    givenConversation();
    ChatMessage first = message(conversation, ChatRole.USER, "0123456789", 1);
    ChatMessage second = message(conversation, ChatRole.ASSISTANT, "abcdefghij", 2);
    ChatMessage older = message(conversation, ChatRole.USER, "older text", 0);
    when(messageStore.findRecent(CONVERSATION_ID, 10)).thenReturn(List.of(first, second));
    when(messageStore.findSimilar(CONVERSATION_ID, "query", 5, 0.7))
        .thenReturn(List.of(new ScoredMessage(second, 0.99), new ScoredMessage(older, 0.8)));
    SubChatSummaryMarker marker =
        new SubChatSummaryMarker(
            UUID.randomUUID(), "Pick db", "Chose Postgres", "Chose Postgres for jsonb", 2,
            Instant.parse("2024-05-01T12:00:00Z"));
    when(messageStore.findRecentContextMarkers(CONVERSATION_ID, 5))
        .thenReturn(List.of(contextMarker(conversation, marker, 3)));
    Conversation previous = conversation(UUID.randomUUID(), USER_ID, "Old");
    when(messageStore.findOtherConversations(USER_ID, CONVERSATION_ID, 3))
        .thenReturn(List.of(previous));
    when(messageStore.findRecent(previous.getId(), 5))
        .thenReturn(
            List.of(
                message(previous, ChatRole.USER, "hi there", 1),
                message(previous, ChatRole.ASSISTANT, "hello", 2)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, true, true, true, false, 1000));

    List<PromptMessage> messages = context.orderedMessages();
    assertThat(messages).hasSize(5);
    assertThat(messages.get(0).content()).isEqualTo("0123456789");
    assertThat(messages.get(1).content()).isEqualTo("abcdefghij");
    assertThat(messages.get(2).content()).isEqualTo("older text");
    assertThat(messages.get(3).role()).isEqualTo(ChatRole.SYSTEM);
    assertThat(messages.get(3).content()).startsWith("SUBCHAT CONTEXT: You have 1 detailed");
    assertThat(messages.get(4).role()).isEqualTo(ChatRole.SYSTEM);
    assertThat(messages.get(4).content())
        .startsWith("PREVIOUS KNOWLEDGE: You have access to 1 previous conversation(s)")
        .contains("Q: hi there\nA: hello");

    ContextMetadata metadata = context.metadata();
    assertThat(metadata.recentMessageCount()).isEqualTo(2);
    assertThat(metadata.semanticMessageCount()).isEqualTo(1);
    assertThat(metadata.subChatCount()).isEqualTo(1);
    assertThat(metadata.previousConversationCount()).isEqualTo(1);
    assertThat(metadata.estimatedTokens())
        .isEqualTo(messages.stream().mapToInt(message -> message.content().length()).sum());
    assertThat(metadata.maxTokens()).isEqualTo(1000);
    assertThat(metadata.truncated()).isFalse();
  }

  @Test
  void keepsRecentMessagesEvenWhenTheyExceedTheBudget() {
    givenConversation();
    String longText = "x".repeat(80);
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(
            List.of(
                message(conversation, ChatRole.USER, longText, 1),
                message(conversation, ChatRole.ASSISTANT, longText, 2)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, true, true, true, false, 100));

    assertThat(context.orderedMessages()).hasSize(2);
    assertThat(context.metadata().estimatedTokens()).isEqualTo(160);
    assertThat(context.metadata().truncated()).isTrue();
    verify(messageStore, never()).findSimilar(any(), any(), anyInt(), anyDouble());
    verify(messageStore, never()).findRecentContextMarkers(any(), anyInt());
    verify(messageStore, never()).findOtherConversations(any(), any(), anyInt());
  }

  @Test
  void excludesContextMarkersFromRecentMessages() {
    givenConversation();
    SubChatSummaryMarker marker =
        new SubChatSummaryMarker(UUID.randomUUID(), null, "Summary", null, 0, Instant.now());
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(
            List.of(
                message(conversation, ChatRole.USER, "question", 1),
                contextMarker(conversation, marker, 2)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, false, false, false, false, 1000));

    assertThat(context.orderedMessages()).extracting(PromptMessage::content).containsExactly("question");
    assertThat(context.metadata().recentMessageCount()).isEqualTo(1);
  }

  @Test
  void skipsSemanticTierWhenEmbeddingFails() {
    givenConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(List.of(message(conversation, ChatRole.USER, "question", 1)));
    when(messageStore.findSimilar(CONVERSATION_ID, "query", 5, 0.7))
        .thenThrow(new GenerationUnavailableException("embedding endpoint down"));
    when(messageStore.findRecentContextMarkers(CONVERSATION_ID, 5)).thenReturn(List.of());

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, true, true, false, false, 1000));

    assertThat(context.orderedMessages()).hasSize(1);
    assertThat(context.metadata().semanticMessageCount()).isZero();
  }

  @Test
  void dropsSubChatBlockThatWouldExceedItsShareOfTheBudget() {
    givenConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(List.of(message(conversation, ChatRole.USER, "x".repeat(20), 1)));
    SubChatSummaryMarker marker =
        new SubChatSummaryMarker(
            UUID.randomUUID(), "Pick db", "Chose Postgres", "Chose Postgres for jsonb", 1,
            Instant.now());
    when(messageStore.findRecentContextMarkers(eq(CONVERSATION_ID), anyInt()))
        .thenReturn(List.of(contextMarker(conversation, marker, 2)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, false, true, false, false, 200));

    assertThat(context.orderedMessages()).hasSize(1);
    assertThat(context.metadata().subChatCount()).isZero();
    assertThat(context.metadata().estimatedTokens()).isEqualTo(20);
  }

  @Test
  void failsForUnknownConversation() {
    UUID unknown = UUID.randomUUID();
    when(messageStore.findConversation(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> assembler.assemble(unknown, "query"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void skipsSemanticTierOnceRecentMessagesReachHalfTheBudget() {
    givenConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(List.of(message(conversation, ChatRole.USER, "x".repeat(65), 1)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, true, false, false, false, 100));

    assertThat(context.orderedMessages()).hasSize(1);
    assertThat(context.metadata().semanticMessageCount()).isZero();
    assertThat(context.metadata().estimatedTokens()).isEqualTo(65);
    verify(messageStore, never()).findSimilar(any(), any(), anyInt(), anyDouble());
  }

  @Test
  void stopsAddingSimilarMessagesOnceSixtyPercentIsReached() {
    givenConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(List.of(message(conversation, ChatRole.USER, "x".repeat(40), 10)));
    ChatMessage first = message(conversation, ChatRole.USER, "a".repeat(15), 1);
    ChatMessage second = message(conversation, ChatRole.ASSISTANT, "b".repeat(10), 2);
    ChatMessage third = message(conversation, ChatRole.USER, "c".repeat(10), 3);
    when(messageStore.findSimilar(CONVERSATION_ID, "query", 5, 0.7))
        .thenReturn(
            List.of(
                new ScoredMessage(first, 0.95),
                new ScoredMessage(second, 0.9),
                new ScoredMessage(third, 0.85)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, true, false, false, false, 100));

    assertThat(context.orderedMessages())
        .extracting(PromptMessage::content)
        .containsExactly("x".repeat(40), "a".repeat(15), "b".repeat(10));
    assertThat(context.metadata().semanticMessageCount()).isEqualTo(2);
    assertThat(context.metadata().estimatedTokens()).isEqualTo(65);
  }

  @Test
  void keepsPreviousKnowledgeThatEndsJustBelowNinetyFivePercent() {
    givenConversation();
    int blockTokens = givenPreviousConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(
            List.of(message(conversation, ChatRole.USER, "x".repeat(949 - blockTokens), 1)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, false, false, true, false, 1000));

    assertThat(context.metadata().previousConversationCount()).isEqualTo(1);
    assertThat(context.metadata().estimatedTokens()).isEqualTo(949);
  }

  @Test
  void dropsPreviousKnowledgeThatWouldReachNinetyFivePercent() {
    givenConversation();
    int blockTokens = givenPreviousConversation();
    when(messageStore.findRecent(CONVERSATION_ID, 10))
        .thenReturn(
            List.of(message(conversation, ChatRole.USER, "x".repeat(950 - blockTokens), 1)));

    AssembledContext context =
        assembler.assemble(
            CONVERSATION_ID, "query", new ContextOptions(10, false, false, true, false, 1000));

    assertThat(context.orderedMessages()).hasSize(1);
    assertThat(context.metadata().previousConversationCount()).isZero();
    assertThat(context.metadata().estimatedTokens()).isEqualTo(950 - blockTokens);
  }

  private void givenConversation() {
    when(messageStore.findConversation(CONVERSATION_ID)).thenReturn(Optional.of(conversation));
  }

  /** Stubs one other conversation and returns the size of its rendered block. */
  private int givenPreviousConversation() {
    Conversation previous = conversation(UUID.randomUUID(), USER_ID, "Old");
    List<ChatMessage> messages =
        List.of(
            message(previous, ChatRole.USER, "hi there", 1),
            message(previous, ChatRole.ASSISTANT, "hello", 2));
    when(messageStore.findOtherConversations(USER_ID, CONVERSATION_ID, 3))
        .thenReturn(List.of(previous));
    when(messageStore.findRecent(previous.getId(), 5)).thenReturn(messages);
    int blockTokens =
        new PreviousKnowledgeRenderer()
            .render(List.of(new PreviousKnowledgeRenderer.ConversationExcerpt(previous, messages)))
            .content()
            .length();
    assertThat(950 - blockTokens).isLessThan(850);
    return blockTokens;
  }
}
