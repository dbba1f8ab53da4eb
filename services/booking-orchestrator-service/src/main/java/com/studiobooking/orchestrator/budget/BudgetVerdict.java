package com.studiobooking.orchestrator.budget;

public record BudgetVerdict(boolean allowed, String reason) {

  public static BudgetVerdict ok() {
    return new BudgetVerdict(true, null);
  }

  public static BudgetVerdict breached(String reason) {
    return new BudgetVerdict(false, reason);
  }
}
