package com.branchat.backend.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "chat_user")
public class ChatUser {

  @Id
  @Column(name = "id", length = 128)
  private String id;

  /** Global consent for storing merged summaries in long-term memory. */
  @Column(name = "memory_opt_in", nullable = false)
  private boolean memoryOptIn;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatUser() {}

  public ChatUser(String id, boolean memoryOptIn) {
    this.id = id;
    this.memoryOptIn = memoryOptIn;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public String getId() {
    return id;
  }

  public boolean isMemoryOptIn() {
    return memoryOptIn;
  }

  public void setMemoryOptIn(boolean memoryOptIn) {
    this.memoryOptIn = memoryOptIn;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
