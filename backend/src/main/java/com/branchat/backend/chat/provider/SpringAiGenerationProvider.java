package com.branchat.backend.chat.provider;

import com.branchat.backend.chat.config.ChatGenerationProperties;
import com.branchat.backend.chat.config.ChatMergeProperties;
import com.branchat.backend.chat.provider.model.GenerationOptions;
import com.branchat.backend.chat.provider.model.PromptMessage;
import com.branchat.backend.chat.provider.model.StructuredSummaryOutcome;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.chat.token.TokenUsageLog;
import com.branchat.backend.chat.token.UsageOperation;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

/** {@link GenerationProvider} backed by a Spring AI {@link ChatClient} and {@link EmbeddingModel}. */
public class SpringAiGenerationProvider implements GenerationProvider {

  private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationProvider.class);

  static final String SUMMARY_SYSTEM_PROMPT =
      "You are a helpful assistant that creates structured summaries of conversations. Always respond with valid JSON.";

  private final ChatClient chatClient;
  private final EmbeddingModel embeddingModel;
  private final StructuredSummaryParser summaryParser;
  private final ChatGenerationProperties generationProperties;
  private final ChatMergeProperties mergeProperties;
  private final TokenEstimator tokenEstimator;
  private final TokenUsageLog usageLog;

  public SpringAiGenerationProvider(
      ChatClient chatClient,
      EmbeddingModel embeddingModel,
      StructuredSummaryParser summaryParser,
      ChatGenerationProperties generationProperties,
      ChatMergeProperties mergeProperties,
      TokenEstimator tokenEstimator,
      TokenUsageLog usageLog) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
    this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
    this.summaryParser = Objects.requireNonNull(summaryParser, "summaryParser must not be null");
    this.generationProperties =
        Objects.requireNonNull(generationProperties, "generationProperties must not be null");
    this.mergeProperties = Objects.requireNonNull(mergeProperties, "mergeProperties must not be null");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    this.usageLog = Objects.requireNonNull(usageLog, "usageLog must not be null");
  }

  @Override
  public String complete(List<PromptMessage> messages, GenerationOptions options) {
    String content;
    try {
      content =
          chatClient
              .prompt()
              .messages(toSpringMessages(messages))
              .options(buildOptions(options))
              .call()
              .content();
    } catch (RuntimeException exception) {
      throw new GenerationUnavailableException(
          "Chat completion failed: " + exception.getMessage(), exception);
    }
    if (!StringUtils.hasText(content)) {
      throw new GenerationUnavailableException("Chat completion returned an empty response");
    }
    usageLog.record(
        UsageOperation.CHAT, modelId(), estimatePromptTokens(messages) + tokenEstimator.estimate(content), null);
    return content;
  }

  @Override
  public Flux<String> completeStreaming(List<PromptMessage> messages, GenerationOptions options) {
    return Flux.defer(
            () ->
                chatClient
                    .prompt()
                    .messages(toSpringMessages(messages))
                    .options(buildOptions(options))
                    .stream()
                    .content())
        .onErrorMap(
            error -> !(error instanceof GenerationUnavailableException),
            error ->
                new GenerationUnavailableException(
                    "Streaming completion failed: " + error.getMessage(), error));
  }

  @Override
  public float[] embed(String text) {
    if (!StringUtils.hasText(text)) {
      throw new IllegalArgumentException("text must not be blank");
    }
    float[] vector;
    try {
      vector = embeddingModel.embed(text);
    } catch (RuntimeException exception) {
      throw new GenerationUnavailableException(
          "Embedding request failed: " + exception.getMessage(), exception);
    }
    if (vector == null || vector.length == 0) {
      throw new GenerationUnavailableException("Embedding model returned an empty vector");
    }
    usageLog.record(
        UsageOperation.EMBEDDING,
        generationProperties.getEmbeddingModel(),
        tokenEstimator.estimate(text),
        null);
    return vector;
  }

  @Override
  public StructuredSummaryOutcome summarizeStructured(String transcript) {
    String raw;
    try {
      raw =
          chatClient
              .prompt()
              .system(SUMMARY_SYSTEM_PROMPT)
              .user(buildSummaryPrompt(transcript))
              .options(
                  buildOptions(
                      new GenerationOptions(
                          mergeProperties.getTemperature(), mergeProperties.getMaxTokens())))
              .call()
              .content();
    } catch (RuntimeException exception) {
      throw new GenerationUnavailableException(
          "Summarisation request failed: " + exception.getMessage(), exception);
    }
    if (!StringUtils.hasText(raw)) {
      throw new GenerationUnavailableException("Summarisation returned no response");
    }
    usageLog.record(
        UsageOperation.SUMMARIZE,
        modelId(),
        tokenEstimator.estimate(transcript) + tokenEstimator.estimate(raw),
        null);
    StructuredSummaryOutcome outcome = summaryParser.parse(raw);
    if (!outcome.isParsed()) {
      log.warn("Structured summary rejected: {}", outcome.failureReason());
    }
    return outcome;
  }

  @Override
  public String modelId() {
    return generationProperties.getModel();
  }

  String buildSummaryPrompt(String transcript) {
    return
        """
        Please analyze the following conversation transcript and provide a structured summary in JSON format with the following fields:
        - summary: A concise overview of the main discussion points and outcomes
        - actions: An array of specific action items or decisions made
        - artifacts: An array of any code, documents, or deliverables mentioned or created
        - keywords: An array of important keywords and topics for future reference

        Transcript:
        %s

        Please respond with valid JSON only:
        """
            .formatted(transcript != null ? transcript : "");
  }

  private ChatOptions buildOptions(GenerationOptions options) {
    GenerationOptions effective =
        (options != null ? options : GenerationOptions.empty())
            .orElse(
                new GenerationOptions(
                    generationProperties.getTemperature(), generationProperties.getMaxTokens()));
    return ChatOptions.builder()
        .temperature(effective.temperature())
        .maxTokens(effective.maxTokens())
        .build();
  }

  private int estimatePromptTokens(List<PromptMessage> messages) {
    if (messages == null) {
      return 0;
    }
    return messages.stream().mapToInt(message -> tokenEstimator.estimate(message.content())).sum();
  }

  private List<Message> toSpringMessages(List<PromptMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      throw new IllegalArgumentException("messages must not be empty");
    }
    return messages.stream().map(this::toSpringMessage).toList();
  }

  private Message toSpringMessage(PromptMessage message) {
    return switch (message.role()) {
      case USER -> new UserMessage(message.content());
      case ASSISTANT -> new AssistantMessage(message.content());
      case SYSTEM -> new SystemMessage(message.content());
    };
  }
}
