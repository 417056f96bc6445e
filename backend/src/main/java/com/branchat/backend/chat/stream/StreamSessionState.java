package com.branchat.backend.chat.stream;

public enum StreamSessionState {
  INIT,
  STREAMING,
  COMPLETED,
  ERRORED,
  DISCONNECTED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERRORED || this == DISCONNECTED;
  }

  /** INIT may only start streaming or be disconnected; STREAMING may end in any terminal state. */
  public boolean canTransitionTo(StreamSessionState next) {
    return switch (this) {
      case INIT -> next == STREAMING || next == DISCONNECTED;
      case STREAMING -> next.isTerminal();
      case COMPLETED, ERRORED, DISCONNECTED -> false;
    };
  }
}
