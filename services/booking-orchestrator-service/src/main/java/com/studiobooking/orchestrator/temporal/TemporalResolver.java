package com.studiobooking.orchestrator.temporal;

import java.time.ZonedDateTime;

public interface TemporalResolver {

  /** Never throws; an unreadable expression gives a result carrying an error. */
  TemporalResult parse(String text, ZonedDateTime now);

  /** Same as {@link #parse(String, ZonedDateTime)} with the current studio time. */
  TemporalResult parse(String text);
}
