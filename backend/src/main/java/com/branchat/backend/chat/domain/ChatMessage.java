package com.branchat.backend.chat.domain;

import com.branchat.backend.chat.domain.converter.SubChatSummaryMarkerConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "chat_message")
public class ChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false)
  private Conversation conversation;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32)
  private ChatRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "sequence_number", nullable = false)
  private Integer sequenceNumber;

  /** Whether the message has a vector in the message vector store. */
  @Column(name = "vector_indexed", nullable = false)
  private boolean vectorIndexed;

  @Column(name = "tokens")
  private Integer tokens;

  @Column(name = "model", length = 128)
  private String model;

  @Column(name = "processing_time_ms")
  private Long processingTimeMs;

  @Column(name = "source_sub_chat_id")
  private UUID sourceSubChatId;

  @Convert(converter = SubChatSummaryMarkerConverter.class)
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "summary_marker", columnDefinition = "jsonb")
  private SubChatSummaryMarker summaryMarker;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatMessage() {}

  public ChatMessage(
      Conversation conversation, ChatRole role, String content, Integer sequenceNumber) {
    this.conversation = conversation;
    this.role = role;
    this.content = content;
    this.sequenceNumber = sequenceNumber;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public ChatRole getRole() {
    return role;
  }

  public String getContent() {
    return content;
  }

  public Integer getSequenceNumber() {
    return sequenceNumber;
  }

  public boolean isVectorIndexed() {
    return vectorIndexed;
  }

  public void markVectorIndexed() {
    this.vectorIndexed = true;
  }

  public Integer getTokens() {
    return tokens;
  }

  public String getModel() {
    return model;
  }

  public Long getProcessingTimeMs() {
    return processingTimeMs;
  }

  public void applyMetadata(Integer tokens, String model, Long processingTimeMs) {
    this.tokens = tokens;
    this.model = model;
    this.processingTimeMs = processingTimeMs;
  }

  public UUID getSourceSubChatId() {
    return sourceSubChatId;
  }

  public void setSourceSubChatId(UUID sourceSubChatId) {
    this.sourceSubChatId = sourceSubChatId;
  }

  public SubChatSummaryMarker getSummaryMarker() {
    return summaryMarker;
  }

  public void setSummaryMarker(SubChatSummaryMarker summaryMarker) {
    this.summaryMarker = summaryMarker;
  }

  /** Context markers are carriers for merged summaries and never part of the visible dialogue. */
  public boolean isContextMarker() {
    return summaryMarker != null;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
