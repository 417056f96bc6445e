package com.branchat.backend.chat.merge;

/** Precondition a sub-conversation failed before any merge step ran. */
public enum MergeRejection {
  SUBCHAT_ALREADY_RESOLVED("Sub-chat has already been resolved"),
  SUBCHAT_CANCELLED("Cannot merge a cancelled sub-chat"),
  EMPTY_TRANSCRIPT("Cannot merge sub-chat with no messages");

  private final String message;

  MergeRejection(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
