package com.studiobooking.orchestrator.api.dto;

import com.studiobooking.orchestrator.budget.BudgetSnapshot;

public record HealthResponse(
    String status, boolean store, boolean crm, BudgetSnapshot budget, long fallbackQueueSize) {}
