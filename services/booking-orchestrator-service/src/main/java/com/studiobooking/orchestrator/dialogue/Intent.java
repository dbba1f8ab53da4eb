package com.studiobooking.orchestrator.dialogue;

import java.util.Locale;

public enum Intent {
  BOOKING,
  SCHEDULE_QUERY,
  PRICE_QUERY,
  INFO,
  GREETING,
  CANCEL,
  ADMIN;

  /** Unknown or missing values read as {@link #INFO}. */
  public static Intent fromWire(String value) {
    if (value == null || value.isBlank()) {
      return INFO;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return INFO;
    }
  }
}
