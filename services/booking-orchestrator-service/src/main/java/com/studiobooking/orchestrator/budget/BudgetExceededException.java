package com.studiobooking.orchestrator.budget;

import lombok.Getter;

@Getter
public class BudgetExceededException extends RuntimeException {

  private final String reason;

  public BudgetExceededException(String reason) {
    super("Budget exceeded: " + reason);
    this.reason = reason;
  }
}
