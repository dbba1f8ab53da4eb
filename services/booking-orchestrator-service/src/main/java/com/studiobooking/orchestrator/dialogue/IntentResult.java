package com.studiobooking.orchestrator.dialogue;

public record IntentResult(Intent intent, ExtractedSlots slots, String responseText) {

  public IntentResult {
    if (intent == null) intent = Intent.INFO;
    if (slots == null) slots = ExtractedSlots.empty();
  }

  public static IntentResult fallback(String rawText) {
    return new IntentResult(Intent.INFO, ExtractedSlots.empty(), rawText);
  }
}
