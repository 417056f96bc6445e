package com.branchat.backend.memory.domain;

import com.branchat.backend.shared.json.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Long-term memory of one merged sub-conversation. The identifier is the sub-conversation id. */
@Entity
@Table(name = "memory_entry")
public class MemoryEntry {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "conversation_id", nullable = false)
  private UUID conversationId;

  @Column(name = "user_id", nullable = false, length = 128)
  private String userId;

  @Column(name = "summary", nullable = false, columnDefinition = "TEXT")
  private String summary;

  @Convert(converter = StringListJsonConverter.class)
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "keywords", columnDefinition = "jsonb")
  private List<String> keywords;

  @Convert(converter = StringListJsonConverter.class)
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "actions", columnDefinition = "jsonb")
  private List<String> actions;

  @Convert(converter = StringListJsonConverter.class)
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "artifacts", columnDefinition = "jsonb")
  private List<String> artifacts;

  /** Whether the entry has a vector in the memory vector store. */
  @Column(name = "vector_indexed", nullable = false)
  private boolean vectorIndexed;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "merged_at", nullable = false)
  private Instant mergedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MemoryEntry() {}

  public MemoryEntry(
      UUID id,
      UUID conversationId,
      String userId,
      String summary,
      List<String> keywords,
      List<String> actions,
      List<String> artifacts,
      Instant createdAt,
      Instant mergedAt) {
    this.id = id;
    this.conversationId = conversationId;
    this.userId = userId;
    this.summary = summary;
    this.keywords = keywords != null ? List.copyOf(keywords) : List.of();
    this.actions = actions != null ? List.copyOf(actions) : List.of();
    this.artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    this.createdAt = createdAt;
    this.mergedAt = mergedAt;
  }

  @PrePersist
  @PreUpdate
  protected void touch() {
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getConversationId() {
    return conversationId;
  }

  public String getUserId() {
    return userId;
  }

  public String getSummary() {
    return summary;
  }

  public List<String> getKeywords() {
    return keywords != null ? keywords : List.of();
  }

  public List<String> getActions() {
    return actions != null ? actions : List.of();
  }

  public List<String> getArtifacts() {
    return artifacts != null ? artifacts : List.of();
  }

  public boolean isVectorIndexed() {
    return vectorIndexed;
  }

  public void setVectorIndexed(boolean vectorIndexed) {
    this.vectorIndexed = vectorIndexed;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getMergedAt() {
    return mergedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
