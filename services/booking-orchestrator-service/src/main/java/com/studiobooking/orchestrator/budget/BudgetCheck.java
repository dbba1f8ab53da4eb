package com.studiobooking.orchestrator.budget;

/** Outcome of one check-and-increment against a single counter. */
public record BudgetCheck(boolean withinLimit, long currentValue) {}
