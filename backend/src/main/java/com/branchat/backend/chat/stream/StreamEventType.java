package com.branchat.backend.chat.stream;

/** Event names of the push protocol. */
public enum StreamEventType {
  CONNECTED("connected"),
  STREAM_START("stream_start"),
  TOKEN("token"),
  STREAM_COMPLETE("stream_complete"),
  STREAM_ERROR("stream_error"),
  HEARTBEAT("heartbeat");

  private final String eventName;

  StreamEventType(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }
}
