package com.studiobooking.orchestrator.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** A mutating CRM request that failed and waits for reconciliation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FallbackItem(
    String id,
    @JsonProperty("trace_id") String traceId,
    String action,
    Map<String, Object> data,
    String error,
    @JsonProperty("created_at") String createdAt) {}
