package com.studiobooking.orchestrator.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Teacher(
    long id, String name, String phone, String email, @JsonProperty("is_active") Boolean active) {

  public static final String[] FIELDS = {"id", "name", "phone", "email", "is_active"};
}
