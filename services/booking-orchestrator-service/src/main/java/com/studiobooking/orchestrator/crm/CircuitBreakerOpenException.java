package com.studiobooking.orchestrator.crm;

public class CircuitBreakerOpenException extends RuntimeException {

  public CircuitBreakerOpenException(String message) {
    super(message);
  }
}
