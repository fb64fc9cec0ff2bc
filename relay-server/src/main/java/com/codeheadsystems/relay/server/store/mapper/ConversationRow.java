package com.codeheadsystems.relay.server.store.mapper;

import java.time.Instant;

/**
 * Row of the {@code conversations} table.
 */
public class ConversationRow {

  private String id;
  private String participantLow;
  private String participantHigh;
  private String lastMessageId;
  private long messageCount;
  private Instant createdAt;
  private Instant updatedAt;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getParticipantLow() {
    return participantLow;
  }

  public void setParticipantLow(String participantLow) {
    this.participantLow = participantLow;
  }

  public String getParticipantHigh() {
    return participantHigh;
  }

  public void setParticipantHigh(String participantHigh) {
    this.participantHigh = participantHigh;
  }

  public String getLastMessageId() {
    return lastMessageId;
  }

  public void setLastMessageId(String lastMessageId) {
    this.lastMessageId = lastMessageId;
  }

  public long getMessageCount() {
    return messageCount;
  }

  public void setMessageCount(long messageCount) {
    this.messageCount = messageCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
