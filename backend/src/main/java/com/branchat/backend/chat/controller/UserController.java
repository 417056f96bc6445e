package com.branchat.backend.chat.controller;

import com.branchat.backend.chat.api.MemoryPreferenceRequest;
import com.branchat.backend.chat.api.UserResponse;
import com.branchat.backend.chat.service.ChatUserService;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/me")
@Validated
public class UserController {

  private static final String USER_HEADER = "X-User-Id";

  private final ChatUserService chatUserService;

  public UserController(ChatUserService chatUserService) {
    this.chatUserService = chatUserService;
  }

  @GetMapping
  public UserResponse current(@RequestHeader(USER_HEADER) String userId) {
    return UserResponse.from(chatUserService.ensureUser(userId));
  }

  @PutMapping("/memory-opt-in")
  public UserResponse updateMemoryOptIn(
      @RequestHeader(USER_HEADER) String userId,
      @RequestBody @Valid MemoryPreferenceRequest request) {
    return UserResponse.from(chatUserService.updateMemoryOptIn(userId, request.memoryOptIn()));
  }
}
