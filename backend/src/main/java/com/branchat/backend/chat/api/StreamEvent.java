package com.branchat.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Payload of a server-sent event pushed to a connected client.")
public record StreamEvent(
    @Schema(description = "Client identifier, present on the connected event.") String clientId,
    @Schema(description = "Model producing the stream, present on stream_start.") String model,
    @Schema(description = "Generated text chunk, present on token events.") String content,
    @Schema(description = "Zero-based index of the chunk within the stream.") Integer tokenIndex,
    @Schema(description = "Identifier of the persisted assistant message.") UUID messageId,
    @Schema(description = "Complete generated text, present on stream_complete.") String fullResponse,
    @Schema(description = "Number of chunks relayed.") Integer tokenCount,
    @Schema(description = "Metadata stored with the assistant message.") StreamMessageMetadata metadata,
    @Schema(description = "Error description, present on stream_error.") String error,
    @Schema(description = "UTC timestamp of the event.") Instant timestamp) {

  public static StreamEvent connected(String clientId, Instant timestamp) {
    return new StreamEvent(clientId, null, null, null, null, null, null, null, null, timestamp);
  }

  public static StreamEvent streamStart(String model, Instant timestamp) {
    return new StreamEvent(null, model, null, null, null, null, null, null, null, timestamp);
  }

  public static StreamEvent token(String content, int tokenIndex) {
    return new StreamEvent(null, null, content, tokenIndex, null, null, null, null, null, null);
  }

  public static StreamEvent complete(
      UUID messageId,
      String fullResponse,
      int tokenCount,
      StreamMessageMetadata metadata,
      Instant timestamp) {
    return new StreamEvent(
        null, null, null, null, messageId, fullResponse, tokenCount, metadata, null, timestamp);
  }

  public static StreamEvent error(String error, Instant timestamp) {
    return new StreamEvent(null, null, null, null, null, null, null, null, error, timestamp);
  }

  public static StreamEvent heartbeat(Instant timestamp) {
    return new StreamEvent(null, null, null, null, null, null, null, null, null, timestamp);
  }
}
