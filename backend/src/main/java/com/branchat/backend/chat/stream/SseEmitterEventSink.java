package com.branchat.backend.chat.stream;

import java.io.IOException;
import java.util.Objects;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** {@link StreamEventSink} writing server-sent events through a Spring MVC {@link SseEmitter}. */
public class SseEmitterEventSink implements StreamEventSink {

  private final SseEmitter emitter;

  public SseEmitterEventSink(SseEmitter emitter) {
    this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
  }

  public SseEmitter emitter() {
    return emitter;
  }

  @Override
  public void send(String eventName, Object payload) throws IOException {
    emitter.send(SseEmitter.event().name(eventName).data(payload));
  }

  @Override
  public void close() {
    emitter.complete();
  }

  @Override
  public void onClose(Runnable callback) {
    emitter.onCompletion(callback);
    emitter.onTimeout(callback);
    emitter.onError(error -> callback.run());
  }
}
