package com.branchat.backend.chat.config;

import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.SpringAiGenerationProvider;
import com.branchat.backend.chat.provider.StructuredSummaryParser;
import com.branchat.backend.chat.token.TokenEstimator;
import com.branchat.backend.chat.token.TokenUsageLog;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatGenerationConfiguration {

  @Bean
  public ChatClient chatClient(ChatModel chatModel) {
    return ChatClient.builder(chatModel).defaultAdvisors(new SimpleLoggerAdvisor()).build();
  }

  @Bean
  public GenerationProvider generationProvider(
      ChatClient chatClient,
      EmbeddingModel embeddingModel,
      StructuredSummaryParser structuredSummaryParser,
      ChatGenerationProperties generationProperties,
      ChatMergeProperties mergeProperties,
      TokenEstimator tokenEstimator,
      TokenUsageLog tokenUsageLog) {
    return new SpringAiGenerationProvider(
        chatClient,
        embeddingModel,
        structuredSummaryParser,
        generationProperties,
        mergeProperties,
        tokenEstimator,
        tokenUsageLog);
  }
}
