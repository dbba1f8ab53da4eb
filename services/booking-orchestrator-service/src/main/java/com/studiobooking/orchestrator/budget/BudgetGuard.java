package com.studiobooking.orchestrator.budget;

import com.studiobooking.orchestrator.config.BudgetProperties;
import com.studiobooking.orchestrator.store.KeyValueStore;
import com.studiobooking.orchestrator.store.KeyValueStore.CounterUpdate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Windowed request, token, cost and error counters guarding calls to the paid generation backend.
 *
 * <p>Each check is one atomic script call on the store: the counter is only incremented when the
 * result stays within the limit. Cost is counted in minor currency units.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetGuard {

  public static final String REQUESTS_EXCEEDED = "MAX_REQUESTS_PER_MINUTE exceeded";
  public static final String TOKENS_EXCEEDED = "MAX_TOKENS_PER_HOUR exceeded";
  public static final String COST_EXCEEDED = "MAX_COST_PER_DAY exceeded";

  private static final Duration MINUTE = Duration.ofMinutes(1);
  private static final Duration HOUR = Duration.ofHours(1);
  private static final Duration DAY = Duration.ofDays(1);

  private final KeyValueStore store;
  private final BudgetProperties props;
  private final Clock clock;

  public BudgetCheck checkRequestsPerMinute() {
    return check(requestsKey(), 1, props.maxRequestsPerMinute(), MINUTE);
  }

  public BudgetCheck checkTokensPerHour(long tokens) {
    return check(tokensKey(), tokens, props.maxTokensPerHour(), HOUR);
  }

  /** Cost in major units; the returned value is in minor units. */
  public BudgetCheck checkCostPerDay(BigDecimal cost) {
    return check(costKey(), toMinor(cost), toMinor(props.maxCostPerDay()), DAY);
  }

  /** Always increments, even past the limit. */
  public long recordError() {
    long n = store.increment(errorsKey(), 1, HOUR);
    if (n >= props.maxErrorsPerHour()) {
      log.warn("Generation errors this hour: {} (limit {})", n, props.maxErrorsPerHour());
    }
    return n;
  }

  /**
   * Requests, then tokens, then cost. Stops at the first breach; counters incremented by earlier
   * checks in the same call stay incremented.
   */
  public BudgetVerdict checkAll(long tokens, BigDecimal cost) {
    if (!checkRequestsPerMinute().withinLimit()) {
      return breach(REQUESTS_EXCEEDED);
    }
    if (!checkTokensPerHour(tokens).withinLimit()) {
      return breach(TOKENS_EXCEEDED);
    }
    if (!checkCostPerDay(cost).withinLimit()) {
      return breach(COST_EXCEEDED);
    }
    return BudgetVerdict.ok();
  }

  public boolean isBreached() {
    return snapshot().breached();
  }

  /** Read-only view of all four counters. */
  public BudgetSnapshot snapshot() {
    long requests = read(requestsKey());
    long tokens = read(tokensKey());
    long costMinor = read(costKey());
    long errors = read(errorsKey());
    boolean breached =
        requests >= props.maxRequestsPerMinute()
            || tokens >= props.maxTokensPerHour()
            || costMinor >= toMinor(props.maxCostPerDay())
            || errors >= props.maxErrorsPerHour();
    return new BudgetSnapshot(
        requests, tokens, BigDecimal.valueOf(costMinor, 2), errors, breached);
  }

  private BudgetCheck check(String key, long amount, long limit, Duration ttl) {
    CounterUpdate u = store.incrementWithinLimit(key, amount, limit, ttl);
    return new BudgetCheck(u.accepted(), u.value());
  }

  private BudgetVerdict breach(String reason) {
    log.warn("Budget breach: {}", reason);
    return BudgetVerdict.breached(reason);
  }

  private long read(String key) {
    return store.get(key).map(BudgetGuard::parseLong).orElse(0L);
  }

  private static long parseLong(String s) {
    try {
      return Long.parseLong(s.trim());
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  static long toMinor(BigDecimal major) {
    if (major == null) {
      return 0L;
    }
    return major.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  String requestsKey() {
    long bucket = clock.instant().getEpochSecond() / 60 * 60;
    return "budget:requests:minute:" + bucket;
  }

  String tokensKey() {
    return "budget:tokens:hour:" + hourBucket();
  }

  String costKey() {
    return "budget:cost:day:" + LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
  }

  String errorsKey() {
    return "budget:errors:hour:" + hourBucket();
  }

  private long hourBucket() {
    return clock.instant().getEpochSecond() / 3600 * 3600;
  }
}
