package com.studiobooking.orchestrator.budget;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.config.BudgetProperties;
import com.studiobooking.orchestrator.store.InMemoryKeyValueStore;
import com.studiobooking.orchestrator.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BudgetGuardTest {

  private MutableClock clock;
  private InMemoryKeyValueStore kv;
  private BudgetGuard guard;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-03-10T08:15:30Z"));
    kv = new InMemoryKeyValueStore(clock);
    guard =
        new BudgetGuard(kv, new BudgetProperties(30, 100_000, new BigDecimal("10.00"), 50), clock);
  }

  @Test
  void tokensUpToTheLimitAreAcceptedAndTheNextOneIsNot() {
    assertThat(guard.checkTokensPerHour(99_999).withinLimit()).isTrue();

    BudgetCheck last = guard.checkTokensPerHour(1);
    assertThat(last.withinLimit()).isTrue();
    assertThat(last.currentValue()).isEqualTo(100_000);

    BudgetCheck over = guard.checkTokensPerHour(1);
    assertThat(over.withinLimit()).isFalse();
    assertThat(over.currentValue()).isEqualTo(100_000);
  }

  @Test
  void rejectedCheckDoesNotIncrementButRefreshesTtl() {
    guard.checkTokensPerHour(99_999);
    clock.advance(Duration.ofMinutes(30));

    BudgetCheck over = guard.checkTokensPerHour(2);

    assertThat(over.withinLimit()).isFalse();
    assertThat(over.currentValue()).isEqualTo(99_999);
    assertThat(kv.ttl(guard.tokensKey())).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void requestCounterStartsOverInTheNextMinute() {
    for (int i = 0; i < 30; i++) {
      assertThat(guard.checkRequestsPerMinute().withinLimit()).isTrue();
    }
    assertThat(guard.checkRequestsPerMinute().withinLimit()).isFalse();

    clock.advance(Duration.ofSeconds(30));
    assertThat(guard.checkRequestsPerMinute().withinLimit()).isTrue();
  }

  @Test
  void costIsCountedInMinorUnits() {
    BudgetCheck first = guard.checkCostPerDay(new BigDecimal("9.995"));
    assertThat(first.withinLimit()).isTrue();
    assertThat(first.currentValue()).isEqualTo(1000);

    assertThat(guard.checkCostPerDay(new BigDecimal("0.004")).withinLimit()).isTrue();
    assertThat(guard.checkCostPerDay(new BigDecimal("0.01")).withinLimit()).isFalse();
  }

  @Test
  void checkAllReportsTheFirstBreachWithoutRollingBackEarlierCounters() {
    guard.checkTokensPerHour(100_000);

    BudgetVerdict verdict = guard.checkAll(10, new BigDecimal("0.01"));

    assertThat(verdict.allowed()).isFalse();
    assertThat(verdict.reason()).isEqualTo(BudgetGuard.TOKENS_EXCEEDED);
    assertThat(kv.get(guard.requestsKey())).contains("1");
    assertThat(kv.get(guard.costKey())).isEmpty();
  }

  @Test
  void checkAllPassesWhenEverythingIsWithinLimits() {
    BudgetVerdict verdict = guard.checkAll(500, new BigDecimal("0.0023"));

    assertThat(verdict.allowed()).isTrue();
    assertThat(verdict.reason()).isNull();
  }

  @Test
  void errorsAreAlwaysCountedAndShowInTheSnapshot() {
    for (int i = 0; i < 55; i++) {
      guard.recordError();
    }

    BudgetSnapshot snapshot = guard.snapshot();
    assertThat(snapshot.errorsThisHour()).isEqualTo(55);
    assertThat(snapshot.breached()).isTrue();
    assertThat(guard.isBreached()).isTrue();
  }

  @Test
  void snapshotIsReadOnly() {
    guard.checkAll(100, new BigDecimal("1.50"));

    BudgetSnapshot snapshot = guard.snapshot();
    guard.snapshot();

    assertThat(snapshot.requestsThisMinute()).isEqualTo(1);
    assertThat(snapshot.tokensThisHour()).isEqualTo(100);
    assertThat(snapshot.costToday()).isEqualByComparingTo("1.50");
    assertThat(snapshot.breached()).isFalse();
    assertThat(guard.snapshot().requestsThisMinute()).isEqualTo(1);
  }

  @Test
  void bucketKeys() {
    assertThat(guard.requestsKey()).isEqualTo("budget:requests:minute:1741594500");
    assertThat(guard.tokensKey()).isEqualTo("budget:tokens:hour:1741593600");
    assertThat(guard.costKey()).isEqualTo("budget:cost:day:2025-03-10");
  }
}
