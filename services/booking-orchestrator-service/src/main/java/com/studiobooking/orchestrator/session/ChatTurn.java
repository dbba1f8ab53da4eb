package com.studiobooking.orchestrator.session;

/** One line of dialogue history. Role is {@code user} or {@code assistant}. */
public record ChatTurn(String role, String text) {

  public static final String USER = "user";
  public static final String ASSISTANT = "assistant";

  public static ChatTurn user(String text) {
    return new ChatTurn(USER, text);
  }

  public static ChatTurn assistant(String text) {
    return new ChatTurn(ASSISTANT, text);
  }
}
