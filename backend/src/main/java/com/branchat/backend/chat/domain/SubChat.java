package com.branchat.backend.chat.domain;

import jakarta.persistence.Column;
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
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/** A branch of a parent conversation that is eventually merged back through a summary. */
@Entity
@Table(name = "sub_chat")
public class SubChat {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_conversation_id", nullable = false)
  private Conversation parentConversation;

  @Column(name = "user_id", nullable = false, length = 128)
  private String userId;

  @Column(name = "title", nullable = false, length = 256)
  private String title;

  /** Text selected in the parent conversation that opened this branch. */
  @Column(name = "context_message", columnDefinition = "TEXT")
  private String contextMessage;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private SubChatStatus status = SubChatStatus.ACTIVE;

  @Column(name = "include_in_memory", nullable = false)
  private boolean includeInMemory = true;

  @Column(name = "summary", columnDefinition = "TEXT")
  private String summary;

  @Column(name = "message_count", nullable = false)
  private int messageCount;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected SubChat() {}

  public SubChat(
      Conversation parentConversation,
      String userId,
      String title,
      String contextMessage,
      boolean includeInMemory) {
    this.parentConversation = parentConversation;
    this.userId = userId;
    this.title = title;
    this.contextMessage = contextMessage;
    this.includeInMemory = includeInMemory;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Conversation getParentConversation() {
    return parentConversation;
  }

  public String getUserId() {
    return userId;
  }

  public String getTitle() {
    return title;
  }

  public String getContextMessage() {
    return contextMessage;
  }

  public SubChatStatus getStatus() {
    return status;
  }

  public boolean isIncludeInMemory() {
    return includeInMemory;
  }

  public String getSummary() {
    return summary;
  }

  public int getMessageCount() {
    return messageCount;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public long getVersion() {
    return version;
  }

  public boolean isOpen() {
    return status == SubChatStatus.ACTIVE;
  }

  public void recordMessage() {
    this.messageCount++;
  }

  public void resolve(String summary, Instant resolvedAt) {
    this.status = SubChatStatus.RESOLVED;
    this.summary = summary;
    this.resolvedAt = resolvedAt;
  }

  public void cancel() {
    this.status = SubChatStatus.CANCELLED;
  }
}
