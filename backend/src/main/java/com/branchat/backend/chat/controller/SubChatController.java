package com.branchat.backend.chat.controller;

import com.branchat.backend.chat.api.GenerationRequestOptions;
import com.branchat.backend.chat.api.MergeResponse;
import com.branchat.backend.chat.api.SubChatMessageRequest;
import com.branchat.backend.chat.api.SubChatMessageResponse;
import com.branchat.backend.chat.api.SubChatResponse;
import com.branchat.backend.chat.api.SubChatTurnResponse;
import com.branchat.backend.chat.merge.SubChatMergeService;
import com.branchat.backend.chat.service.SubChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/subchats")
@Validated
@Tag(name = "Sub-chats", description = "Side conversations and their merge into the parent.")
public class SubChatController {

  private static final String USER_HEADER = "X-User-Id";

  private final SubChatService subChatService;
  private final SubChatMergeService mergeService;

  public SubChatController(SubChatService subChatService, SubChatMergeService mergeService) {
    this.subChatService = subChatService;
    this.mergeService = mergeService;
  }

  @GetMapping(value = "/{subChatId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public SubChatResponse get(
      @RequestHeader(USER_HEADER) String userId, @PathVariable UUID subChatId) {
    return SubChatResponse.from(subChatService.requireOwned(subChatId, userId));
  }

  @GetMapping(value = "/{subChatId}/messages", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<SubChatMessageResponse> messages(
      @RequestHeader(USER_HEADER) String userId, @PathVariable UUID subChatId) {
    return subChatService.messages(subChatId, userId).stream()
        .map(SubChatMessageResponse::from)
        .toList();
  }

  @PostMapping(
      value = "/{subChatId}/messages",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Send a message inside an active sub-chat.")
  public SubChatTurnResponse addMessage(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable UUID subChatId,
      @RequestBody @Valid SubChatMessageRequest request) {
    SubChatService.SubChatExchange exchange =
        subChatService.addMessage(
            subChatId,
            userId,
            request.content(),
            GenerationRequestOptions.toOptions(request.options()));
    return new SubChatTurnResponse(
        SubChatMessageResponse.from(exchange.userMessage()),
        SubChatMessageResponse.from(exchange.assistantMessage()));
  }

  @PostMapping(value = "/{subChatId}/merge", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Summarize the sub-chat and inject the summary into the parent conversation.",
      description =
          "Marks the sub-chat resolved. The summary is stored in long-term memory when the sub-chat allows it and the user opted in.")
  @ApiResponse(responseCode = "404", description = "Sub-chat not found.")
  @ApiResponse(
      responseCode = "409",
      description = "Sub-chat already resolved, cancelled or without messages.")
  @ApiResponse(responseCode = "502", description = "Summary generation failed.")
  public MergeResponse merge(
      @RequestHeader(USER_HEADER) String userId, @PathVariable UUID subChatId) {
    return MergeResponse.from(mergeService.merge(subChatId, userId));
  }

  @PostMapping(value = "/{subChatId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
  public SubChatResponse cancel(
      @RequestHeader(USER_HEADER) String userId, @PathVariable UUID subChatId) {
    return SubChatResponse.from(subChatService.cancel(subChatId, userId));
  }
}
