package com.branchat.backend.chat.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.branchat.backend.chat.domain.SubChat;
import com.branchat.backend.chat.domain.SubChatStatus;
import com.branchat.backend.chat.merge.MergeRejection;
import com.branchat.backend.chat.merge.MergeResult;
import com.branchat.backend.chat.merge.SubChatMergeRejectedException;
import com.branchat.backend.chat.merge.SubChatMergeService;
import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.branchat.backend.chat.service.SubChatService;
import com.branchat.backend.common.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SubChatController.class)
@AutoConfigureMockMvc(addFilters = false)
class SubChatControllerTest {

  private static final String USER_ID = "user-1";

  @Autowired private MockMvc mockMvc;

  @MockBean private SubChatService subChatService;
  @MockBean private SubChatMergeService mergeService;

  @Test
  void mergeReturnsInjectedSummary() throws Exception {
    UUID subChatId = UUID.randomUUID();
    UUID conversationId = UUID.randomUUID();
    UUID injectedId = UUID.randomUUID();
    Instant resolvedAt = Instant.parse("2024-05-01T12:00:00Z");
    when(mergeService.merge(subChatId, USER_ID))
        .thenReturn(
            new MergeResult(
                subChatId,
                conversationId,
                SubChatStatus.RESOLVED,
                resolvedAt,
                new StructuredSummary(
                    "Chose a GIN index", List.of("Created index"), List.of(), List.of("index")),
                false,
                injectedId,
                "## Sub-chat Summary\n\nChose a GIN index",
                resolvedAt,
                null,
                true));

    mockMvc
        .perform(post("/api/subchats/{id}/merge", subChatId).header("X-User-Id", USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("resolved"))
        .andExpect(jsonPath("$.conversationId").value(conversationId.toString()))
        .andExpect(jsonPath("$.summary.summary").value("Chose a GIN index"))
        .andExpect(jsonPath("$.summary.actions[0]").value("Created index"))
        .andExpect(jsonPath("$.injectedMessage.id").value(injectedId.toString()))
        .andExpect(jsonPath("$.contextMarkerId").doesNotExist())
        .andExpect(jsonPath("$.memoryStored").value(true));
  }

  @Test
  void rejectedMergeIsConflictWithCode() throws Exception {
    UUID subChatId = UUID.randomUUID();
    when(mergeService.merge(subChatId, USER_ID))
        .thenThrow(
            new SubChatMergeRejectedException(MergeRejection.SUBCHAT_ALREADY_RESOLVED, subChatId));

    mockMvc
        .perform(post("/api/subchats/{id}/merge", subChatId).header("X-User-Id", USER_ID))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("SUBCHAT_ALREADY_RESOLVED"));
  }

  @Test
  void mergeOfUnknownSubChatIsNotFound() throws Exception {
    UUID subChatId = UUID.randomUUID();
    when(mergeService.merge(subChatId, USER_ID))
        .thenThrow(new ResourceNotFoundException("Sub-chat", subChatId));

    mockMvc
        .perform(post("/api/subchats/{id}/merge", subChatId).header("X-User-Id", USER_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Sub-chat not found"));
  }

  @Test
  void staleCancelIsConflict() throws Exception {
    UUID subChatId = UUID.randomUUID();
    when(subChatService.cancel(subChatId, USER_ID))
        .thenThrow(new ObjectOptimisticLockingFailureException(SubChat.class, subChatId));

    mockMvc
        .perform(post("/api/subchats/{id}/cancel", subChatId).header("X-User-Id", USER_ID))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Concurrent update"));
  }

  @Test
  void malformedSubChatIdIsRejected() throws Exception {
    mockMvc
        .perform(post("/api/subchats/not-a-uuid/merge").header("X-User-Id", USER_ID))
        .andExpect(status().isBadRequest());
  }
}
