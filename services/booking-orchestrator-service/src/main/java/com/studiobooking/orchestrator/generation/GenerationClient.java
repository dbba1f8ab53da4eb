package com.studiobooking.orchestrator.generation;

import java.util.List;

/** Provider-specific completion call. */
public interface GenerationClient {

  /**
   * @throws GenerationException on any transport or protocol failure
   */
  GenerationResponse complete(List<PromptMessage> messages);

  String modelName();
}
