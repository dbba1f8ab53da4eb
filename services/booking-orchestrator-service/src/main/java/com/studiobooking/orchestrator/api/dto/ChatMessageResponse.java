package com.studiobooking.orchestrator.api.dto;

public record ChatMessageResponse(String reply, String traceId) {}
