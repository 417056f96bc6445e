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
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "sub_chat_message")
public class SubChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "sub_chat_id", nullable = false)
  private SubChat subChat;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32)
  private ChatRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "sequence_number", nullable = false)
  private Integer sequenceNumber;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SubChatMessage() {}

  public SubChatMessage(SubChat subChat, ChatRole role, String content, Integer sequenceNumber) {
    this.subChat = subChat;
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

  public SubChat getSubChat() {
    return subChat;
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

  public Instant getCreatedAt() {
    return createdAt;
  }
}
