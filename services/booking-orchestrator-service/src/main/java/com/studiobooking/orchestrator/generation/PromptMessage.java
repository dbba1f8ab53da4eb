package com.studiobooking.orchestrator.generation;

/** One message sent to the model. Role is {@code system}, {@code user} or {@code assistant}. */
public record PromptMessage(String role, String text) {

  public static PromptMessage system(String text) {
    return new PromptMessage("system", text);
  }

  public static PromptMessage user(String text) {
    return new PromptMessage("user", text);
  }
}
