package com.branchat.backend.chat.token;

public enum UsageOperation {
  CHAT,
  SUMMARIZE,
  EMBEDDING
}
