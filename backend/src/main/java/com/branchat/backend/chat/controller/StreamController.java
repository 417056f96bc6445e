package com.branchat.backend.chat.controller;

import com.branchat.backend.chat.stream.SseEmitterEventSink;
import com.branchat.backend.chat.stream.StreamingDeliveryEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/stream")
@Validated
@Slf4j
@Tag(name = "Streaming", description = "Server-sent event channel per client.")
public class StreamController {

  private final StreamingDeliveryEngine streamingEngine;

  public StreamController(StreamingDeliveryEngine streamingEngine) {
    this.streamingEngine = streamingEngine;
  }

  @GetMapping(value = "/connect", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Open the event channel of a client.",
      description =
          "Sends a connected event, then stream_start, token, stream_complete or stream_error events for every streamed turn and periodic heartbeats. Connecting again with the same client id replaces the previous channel.")
  public SseEmitter connect(@RequestParam("clientId") @NotBlank @Size(max = 128) String clientId) {
    SseEmitter emitter = new SseEmitter(0L);
    streamingEngine.initialize(clientId, new SseEmitterEventSink(emitter));
    log.debug("Client {} connected to the event stream", clientId);
    return emitter;
  }

  @DeleteMapping("/{clientId}")
  @Operation(summary = "Close the event channel of a client and stop its active stream.")
  public ResponseEntity<Void> disconnect(@PathVariable String clientId) {
    return streamingEngine.disconnect(clientId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }
}
