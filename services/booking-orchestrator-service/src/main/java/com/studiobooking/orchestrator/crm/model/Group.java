package com.studiobooking.orchestrator.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    long id,
    String name,
    @JsonProperty("style_id") Long styleId,
    @JsonProperty("teacher_id") Long teacherId,
    String description,
    @JsonProperty("is_active") Boolean active) {

  public static final String[] FIELDS = {
    "id", "name", "style_id", "teacher_id", "description", "is_active"
  };
}
