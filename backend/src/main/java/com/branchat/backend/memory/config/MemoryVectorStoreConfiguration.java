package com.branchat.backend.memory.config;

import com.branchat.backend.chat.provider.GenerationProvider;
import com.branchat.backend.chat.provider.GenerationProviderEmbeddingModel;
import com.branchat.backend.shared.vector.PgVectorStores;
import javax.sql.DataSource;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MemoryVectorStoreConfiguration {

  public static final String MEMORY_VECTOR_STORE = "memoryVectorStore";

  @Bean(name = MEMORY_VECTOR_STORE)
  public VectorStore memoryVectorStore(
      DataSource dataSource, GenerationProvider generationProvider, MemoryProperties properties) {
    return PgVectorStores.create(
        dataSource,
        new GenerationProviderEmbeddingModel(
            generationProvider, properties.getStorage().getDimensions()),
        properties.getStorage());
  }
}
