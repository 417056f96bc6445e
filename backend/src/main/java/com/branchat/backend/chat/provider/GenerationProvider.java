package com.branchat.backend.chat.provider;

import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.provider.model.StructuredSummaryOutcome;
import java.util.List;
import reactor.core.publisher.Flux;

/**
 * Language model operations used by the chat back end. Failures to obtain any response surface as
 * {@link GenerationUnavailableException}.
 */
public interface GenerationProvider {

  String complete(List<PromptMessage> messages, GenerationOptions options);

  /**
   * Streams generated text chunks. Cancelling the subscription aborts the upstream request.
   */
  Flux<String> completeStreaming(List<PromptMessage> messages, GenerationOptions options);

  float[] embed(String text);

  /**
   * Requests a JSON summary of a transcript. An answer that does not match the expected shape is
   * returned as an unparseable outcome instead of an exception.
   */
  StructuredSummaryOutcome summarizeStructured(String transcript);

  /** Model identifier reported in message metadata. */
  String modelId();
}
