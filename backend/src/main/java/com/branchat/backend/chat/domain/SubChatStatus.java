package com.branchat.backend.chat.domain;

public enum SubChatStatus {
  ACTIVE,
  RESOLVED,
  CANCELLED
}
