package com.branchat.backend.chat.config;

import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.GenerationProviderEmbeddingModel;
import com.branchat.backend.shared.vector.PgVectorStores;
import javax.sql.DataSource;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatVectorStoreConfiguration {

  public static final String MESSAGE_VECTOR_STORE = "messageVectorStore";

  @Bean(name = MESSAGE_VECTOR_STORE)
  public VectorStore messageVectorStore(
      DataSource dataSource,
      GenerationProvider generationProvider,
      ChatEmbeddingProperties properties) {
    return PgVectorStores.create(
        dataSource,
        new GenerationProviderEmbeddingModel(
            generationProvider, properties.getStorage().getDimensions()),
        properties.getStorage());
  }
}
