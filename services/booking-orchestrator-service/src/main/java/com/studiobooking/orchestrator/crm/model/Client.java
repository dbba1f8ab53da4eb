package com.studiobooking.orchestrator.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Client(
    long id,
    String name,
    String phone,
    String email,
    @JsonProperty("informer_id") Long informerId) {

  public static final String[] FIELDS = {"id", "name", "phone", "email", "informer_id"};
}
