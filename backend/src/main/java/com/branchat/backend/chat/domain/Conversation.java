package com.branchat.backend.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "conversation")
public class Conversation {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "user_id", nullable = false, length = 128)
  private String userId;

  @Column(name = "title", nullable = false, length = 256)
  private String title;

  @Column(name = "message_count", nullable = false)
  private int messageCount;

  @Column(name = "last_message_at")
  private Instant lastMessageAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Conversation() {}

  public Conversation(String userId, String title) {
    this.userId = userId;
    this.title = title;
  }

  @PrePersist
  protected void onPersist() {
    Instant now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public String getTitle() {
    return title;
  }

  public int getMessageCount() {
    return messageCount;
  }

  public Instant getLastMessageAt() {
    return lastMessageAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void recordMessage(Instant at) {
    this.messageCount++;
    this.lastMessageAt = at;
  }
}
