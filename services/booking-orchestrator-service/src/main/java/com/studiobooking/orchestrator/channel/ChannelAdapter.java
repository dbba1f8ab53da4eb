package com.studiobooking.orchestrator.channel;

/** Outbound side of a messaging channel. */
public interface ChannelAdapter {

  String name();

  /** @return false when the message could not be delivered */
  boolean send(String chatId, String text);

  /** Shows the "typing" indicator. Best-effort. */
  void sendTyping(String chatId);
}
