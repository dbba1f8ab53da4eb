package com.studiobooking.orchestrator.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {

  private String channel;
  private String chatId;
  private String traceId;
  private ConversationState state = ConversationState.IDLE;
  private SlotValues slots = new SlotValues();
  private Instant createdAt;
  private Instant updatedAt;
  private Instant expiresAt;

  public Session(String channel, String chatId, String traceId, Instant now) {
    this.channel = channel;
    this.chatId = chatId;
    this.traceId = traceId;
    this.createdAt = now;
    this.updatedAt = now;
    this.expiresAt = now;
  }
}
