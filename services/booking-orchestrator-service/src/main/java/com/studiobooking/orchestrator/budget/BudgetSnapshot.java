package com.studiobooking.orchestrator.budget;

import java.math.BigDecimal;

public record BudgetSnapshot(
    long requestsThisMinute,
    long tokensThisHour,
    BigDecimal costToday,
    long errorsThisHour,
    boolean breached) {}
