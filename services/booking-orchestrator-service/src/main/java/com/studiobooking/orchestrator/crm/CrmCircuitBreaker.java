package com.studiobooking.orchestrator.crm;

import com.studiobooking.orchestrator.config.CrmProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Consecutive-failure breaker in front of the CRM. State is local to this instance.
 *
 * <p>After {@code resetTimeout} since the last failure one trial call is let through; its outcome
 * closes the breaker or re-opens it for another full timeout.
 */
@Component
@Slf4j
public class CrmCircuitBreaker {

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Clock clock;

  private State state = State.CLOSED;
  private int failureCount;
  private Instant lastFailureAt;

  public CrmCircuitBreaker(CrmProperties props, Clock clock) {
    this(props.failureThreshold(), props.resetTimeout(), clock);
  }

  public CrmCircuitBreaker(int failureThreshold, Duration resetTimeout, Clock clock) {
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.clock = clock;
  }

  /**
   * @return true if a call may go out now
   */
  public synchronized boolean tryAcquirePermission() {
    switch (state) {
      case CLOSED:
        return true;
      case OPEN:
        if (lastFailureAt == null
            || Duration.between(lastFailureAt, clock.instant()).compareTo(resetTimeout) >= 0) {
          state = State.HALF_OPEN;
          log.info("CRM circuit half-open, letting a trial call through");
          return true;
        }
        return false;
      case HALF_OPEN:
      default:
        // trial already in flight
        return false;
    }
  }

  public synchronized void onSuccess() {
    if (state != State.CLOSED) {
      log.info("CRM circuit closed");
    }
    state = State.CLOSED;
    failureCount = 0;
    lastFailureAt = null;
  }

  public synchronized void onFailure() {
    failureCount++;
    lastFailureAt = clock.instant();
    if (state == State.HALF_OPEN || failureCount >= failureThreshold) {
      if (state != State.OPEN) {
        log.warn("CRM circuit opened after {} consecutive failures", failureCount);
      }
      state = State.OPEN;
    }
  }

  public synchronized State state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }
}
