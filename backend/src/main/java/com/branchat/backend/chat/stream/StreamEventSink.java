package com.branchat.backend.chat.stream;

import java.io.IOException;

/**
 * Client-facing push channel. Implementations must invoke the close callback as soon as the
 * underlying transport closes, times out or fails.
 */
public interface StreamEventSink {

  void send(String eventName, Object payload) throws IOException;

  /** Closes the channel from the server side. */
  void close();

  void onClose(Runnable callback);
}
