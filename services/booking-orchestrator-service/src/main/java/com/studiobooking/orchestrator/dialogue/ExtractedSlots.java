package com.studiobooking.orchestrator.dialogue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Slot values as the model returned them. {@code datetime} is the raw expression. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedSlots(
    String group,
    String datetime,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("client_phone") String clientPhone) {

  public static ExtractedSlots empty() {
    return new ExtractedSlots(null, null, null, null);
  }
}
