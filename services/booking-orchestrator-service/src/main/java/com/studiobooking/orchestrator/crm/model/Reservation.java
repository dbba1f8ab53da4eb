package com.studiobooking.orchestrator.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Reservation(
    long id,
    @JsonProperty("client_id") long clientId,
    @JsonProperty("schedule_id") long scheduleId,
    @JsonProperty("status_id") Long statusId,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt,
    String notes) {

  public static final String[] FIELDS = {
    "id", "client_id", "schedule_id", "status_id", "created_at", "updated_at", "notes"
  };
}
