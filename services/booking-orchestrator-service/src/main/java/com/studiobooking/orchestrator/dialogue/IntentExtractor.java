package com.studiobooking.orchestrator.dialogue;

import com.studiobooking.orchestrator.session.ChatTurn;
import com.studiobooking.orchestrator.session.ConversationState;
import com.studiobooking.orchestrator.session.SlotValues;
import java.util.List;

public interface IntentExtractor {

  /**
   * Classifies the message and extracts slots. Malformed model output never raises: it gives
   * {@link IntentResult#fallback(String)} with the raw text.
   *
   * @throws com.studiobooking.orchestrator.budget.BudgetExceededException when the generation
   *     budget is exhausted
   * @throws com.studiobooking.orchestrator.generation.GenerationException when the model call fails
   */
  IntentResult resolve(
      String message, ConversationState state, SlotValues slots, List<ChatTurn> history);
}
