package com.branchat.backend.chat.domain;

public enum ChatRole {
  USER,
  ASSISTANT,
  SYSTEM;

  public String label() {
    return switch (this) {
      case USER -> "User";
      case ASSISTANT -> "Assistant";
      case SYSTEM -> "System";
    };
  }
}
