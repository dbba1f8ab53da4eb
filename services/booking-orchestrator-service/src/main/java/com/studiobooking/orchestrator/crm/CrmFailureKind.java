package com.studiobooking.orchestrator.crm;

public enum CrmFailureKind {
  SERVER_ERROR,
  TIMEOUT,
  BREAKER_OPEN,
  NOT_FOUND,
  CLIENT_ERROR,
  NO_SEATS,
  ALREADY_BOOKED,
  CLASS_PASSED,
  GROUP_FULL,
  UNKNOWN
}
