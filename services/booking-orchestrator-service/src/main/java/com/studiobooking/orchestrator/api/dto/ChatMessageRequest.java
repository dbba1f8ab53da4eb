package com.studiobooking.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatMessageRequest(
    @NotBlank @Size(max = 32) String channel,
    @NotBlank @Size(max = 128) String chatId,
    @Size(max = 128) String messageId,
    @NotBlank @Size(max = 4096) String text) {}
