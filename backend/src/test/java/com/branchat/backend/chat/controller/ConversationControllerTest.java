package com.branchat.backend.chat.controller;

import static com.branchat.backend.chat.TestChatDataFactory.conversation;
import static com.branchat.backend.chat.TestChatDataFactory.message;
import static com.branchat.backend.chat.TestChatDataFactory.subChat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.branchat.backend.chat.config.ChatContextProperties;
import com.branchat.backend.chat.context.ContextMetadata;
import com.branchat.backend.chat.context.ContextOptions;
import com.branchat.backend.chat.domain.ChatMessage;
import com.branchat.backend.chat.domain.ChatRole;
import com.branchat.backend.chat.domain.Conversation;
import com.branchat.backend.chat.embedding.BackfillResult;
import com.branchat.backend.chat.embedding.MessageEmbeddingQueue;
import com.branchat.backend.chat.provider.GenerationUnavailableException;
import com.branchat.backend.chat.service.ConversationService;
import com.branchat.backend.chat.service.ConversationTurnService;
import com.branchat.backend.chat.service.SubChatService;
import com.branchat.backend.chat.service.TurnCommand;
import com.branchat.backend.chat.service.TurnResult;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ConversationController.class)
@AutoConfigureMockMvc(addFilters = false)
class ConversationControllerTest {

  private static final String USER_ID = "user-1";

  @Autowired private MockMvc mockMvc;

  @MockBean private ConversationService conversationService;
  @MockBean private ConversationTurnService turnService;
  @MockBean private SubChatService subChatService;
  @MockBean private MessageEmbeddingQueue embeddingQueue;

  @Test
  void startReturnsCreatedConversation() throws Exception {
    Conversation conversation = conversation(UUID.randomUUID(), USER_ID, "Backups");
    UUID userMessageId = UUID.randomUUID();
    when(conversationService.start(USER_ID, "Backups", true, "What about backups?"))
        .thenReturn(new ConversationService.StartedConversation(conversation, userMessageId, 2));

    mockMvc
        .perform(
            post("/api/conversations/start")
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Backups","useMemory":true,"initialMessage":"What about backups?"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.conversation.id").value(conversation.getId().toString()))
        .andExpect(jsonPath("$.conversation.title").value("Backups"))
        .andExpect(jsonPath("$.userMessageId").value(userMessageId.toString()))
        .andExpect(jsonPath("$.memoriesUsed").value(2));
  }

  @Test
  void sendMessageAppliesContextOverridesOnConfiguredDefaults() throws Exception {
    Conversation conversation = conversation(UUID.randomUUID(), USER_ID, "Turns");
    ChatMessage user = message(conversation, ChatRole.USER, "What is MVCC?", 1);
    ChatMessage assistant = message(conversation, ChatRole.ASSISTANT, "Row versions.", 2);
    ContextMetadata metadata = new ContextMetadata(1, 0, 0, 0, 20, 2000, false);
    when(turnService.sendMessage(eq(conversation.getId()), eq(USER_ID), any(TurnCommand.class)))
        .thenReturn(new TurnResult(user, assistant, metadata));

    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", conversation.getId())
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"content":"What is MVCC?",
                     "context":{"maxTokens":2000,"enablePreviousKnowledge":true},
                     "options":{"temperature":0.3}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userMessage.role").value("user"))
        .andExpect(jsonPath("$.assistantMessage.content").value("Row versions."))
        .andExpect(jsonPath("$.context.maxTokens").value(2000));

    ArgumentCaptor<TurnCommand> captor = ArgumentCaptor.forClass(TurnCommand.class);
    verify(turnService).sendMessage(eq(conversation.getId()), eq(USER_ID), captor.capture());
    ContextOptions options = captor.getValue().contextOptions();
    assertThat(options.maxTokens()).isEqualTo(2000);
    assertThat(options.enablePreviousKnowledge()).isTrue();
    assertThat(options.recentMessageCount()).isEqualTo(10);
    assertThat(options.enableSemantic()).isTrue();
    assertThat(captor.getValue().options().temperature()).isEqualTo(0.3);
  }

  @Test
  void sendMessageWithoutOverridesLeavesContextOptionsUnset() throws Exception {
    Conversation conversation = conversation(UUID.randomUUID(), USER_ID, "Turns");
    when(turnService.sendMessage(eq(conversation.getId()), eq(USER_ID), any(TurnCommand.class)))
        .thenReturn(
            new TurnResult(
                message(conversation, ChatRole.USER, "Hi", 1),
                message(conversation, ChatRole.ASSISTANT, "Hello", 2),
                new ContextMetadata(1, 0, 0, 0, 2, 8000, false)));

    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", conversation.getId())
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"Hi\"}"))
        .andExpect(status().isOk());

    ArgumentCaptor<TurnCommand> captor = ArgumentCaptor.forClass(TurnCommand.class);
    verify(turnService).sendMessage(eq(conversation.getId()), eq(USER_ID), captor.capture());
    assertThat(captor.getValue().contextOptions()).isNull();
  }

  @Test
  void blankMessageIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", UUID.randomUUID())
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Validation failed"));
    verifyNoInteractions(turnService);
  }

  @Test
  void missingUserHeaderIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"Hi\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Missing required header X-User-Id"));
  }

  @Test
  void unknownConversationIsNotFound() throws Exception {
    UUID conversationId = UUID.randomUUID();
    when(turnService.sendMessage(eq(conversationId), eq(USER_ID), any(TurnCommand.class)))
        .thenThrow(new ResourceNotFoundException("Conversation", conversationId));

    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", conversationId)
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"Hi\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Conversation not found"));
  }

  @Test
  void generationFailureIsBadGateway() throws Exception {
    UUID conversationId = UUID.randomUUID();
    when(turnService.sendMessage(eq(conversationId), eq(USER_ID), any(TurnCommand.class)))
        .thenThrow(new GenerationUnavailableException("model offline"));

    mockMvc
        .perform(
            post("/api/conversations/{id}/messages", conversationId)
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"Hi\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.detail").value("model offline"));
  }

  @Test
  void backfillRunsForOwnedConversation() throws Exception {
    UUID conversationId = UUID.randomUUID();
    when(embeddingQueue.backfill(conversationId))
        .thenReturn(new BackfillResult(conversationId, 4, 3, 1, 0, 1));

    mockMvc
        .perform(
            post("/api/conversations/{id}/embeddings/backfill", conversationId)
                .header("X-User-Id", USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.embedded").value(3))
        .andExpect(jsonPath("$.skipped").value(1));
    verify(conversationService).requireOwned(conversationId, USER_ID);
  }

  @Test
  void createSubChatIncludesInMemoryByDefault() throws Exception {
    Conversation parent = conversation(UUID.randomUUID(), USER_ID, "Parent");
    when(subChatService.create(parent.getId(), USER_ID, "Side", "the retry loop", true))
        .thenReturn(subChat(UUID.randomUUID(), parent, USER_ID, "Side", true));

    mockMvc
        .perform(
            post("/api/conversations/{id}/subchats", parent.getId())
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Side\",\"contextMessage\":\"the retry loop\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.conversationId").value(parent.getId().toString()))
        .andExpect(jsonPath("$.status").value("active"));
  }

  @TestConfiguration
  @EnableConfigurationProperties(ChatContextProperties.class)
  static class ContextPropertiesConfiguration {}
}
