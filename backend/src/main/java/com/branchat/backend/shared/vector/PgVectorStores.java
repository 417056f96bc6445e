package com.branchat.backend.shared.vector;

import javax.sql.DataSource;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore.PgDistanceType;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore.PgIdType;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore.PgIndexType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.Assert;

public final class PgVectorStores {

  private PgVectorStores() {}

  /**
   * Cosine-distance store over a Liquibase-managed table with UUID ids. Scores returned by searches
   * are cosine similarities.
   */
  public static VectorStore create(
      DataSource dataSource, EmbeddingModel embeddingModel, VectorStorage storage) {
    Assert.hasText(storage.getVectorTable(), "vector table must be configured");
    JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    return PgVectorStore.builder(jdbcTemplate, embeddingModel)
        .vectorTableName(storage.getVectorTable())
        .dimensions(storage.getDimensions())
        .distanceType(PgDistanceType.COSINE_DISTANCE)
        .idType(PgIdType.UUID)
        .indexType(PgIndexType.HNSW)
        .initializeSchema(false)
        .vectorTableValidationsEnabled(storage.isSchemaValidation())
        .build();
  }
}
