package com.studiobooking.orchestrator.temporal;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/** Resolved date and time, or an error text when the expression could not be resolved. */
public record TemporalResult(
    LocalDate date, LocalTime time, Confidence confidence, String rawInput, String error) {

  public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
  }

  public static TemporalResult failed(String rawInput, String error) {
    return new TemporalResult(null, null, Confidence.LOW, rawInput, error);
  }

  public boolean isResolved() {
    return error == null && date != null;
  }

  /** Falls back to {@code defaultTime} when only the date was given. */
  public Optional<ZonedDateTime> toDateTime(ZoneId zone, LocalTime defaultTime) {
    if (!isResolved()) {
      return Optional.empty();
    }
    return Optional.of(ZonedDateTime.of(date, time == null ? defaultTime : time, zone));
  }
}
