package com.branchat.backend.memory.controller;

import com.branchat.backend.memory.api.MemoryCleanupRequest;
import com.branchat.backend.memory.api.MemoryCleanupResponse;
import com.branchat.backend.memory.api.MemorySearchResponse;
import com.branchat.backend.memory.model.MemorySearchResult;
import com.branchat.backend.memory.model.MemoryStats;
import com.branchat.backend.memory.service.MemoryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/memory")
@Validated
public class MemoryController {

  static final String USER_HEADER = "X-User-Id";

  private final MemoryService memoryService;

  public MemoryController(MemoryService memoryService) {
    this.memoryService = memoryService;
  }

  @GetMapping("/search")
  public MemorySearchResponse search(
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam("q") @NotBlank String query,
      @RequestParam(value = "topK", required = false) @Min(1) @Max(50) Integer topK,
      @RequestParam(value = "excludeConversationId", required = false)
          UUID excludeConversationId) {
    List<MemorySearchResult> results =
        excludeConversationId != null
            ? memoryService.getRelevantMemories(query, userId, excludeConversationId, topK)
            : memoryService.searchMemories(query, userId, topK);
    return new MemorySearchResponse(query, memoryService.isAvailable(), results);
  }

  @GetMapping("/stats")
  public MemoryStats stats(@RequestHeader(USER_HEADER) String userId) {
    return memoryService.getUserMemoryStats(userId);
  }

  @DeleteMapping("/{subChatId}")
  public ResponseEntity<Void> delete(@PathVariable UUID subChatId) {
    memoryService.deleteMemory(subChatId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/cleanup")
  public MemoryCleanupResponse cleanup(
      @RequestHeader(USER_HEADER) String userId, @RequestBody @Valid MemoryCleanupRequest request) {
    int deleted =
        memoryService.cleanupUserMemories(userId, request.olderThanDays(), request.maxEntries());
    return new MemoryCleanupResponse(deleted);
  }
}
