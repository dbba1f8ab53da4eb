package com.studiobooking.orchestrator.generation;

public record GenerationResponse(String text, long tokensUsed) {}
