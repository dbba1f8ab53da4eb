package com.studiobooking.orchestrator.idempotency;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.idempotency.IdempotencyGuard.LockResult;
import com.studiobooking.orchestrator.store.InMemoryKeyValueStore;
import com.studiobooking.orchestrator.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class IdempotencyGuardTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T08:00:00Z"));
  private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore(clock);
  private final IdempotencyGuard guard = new IdempotencyGuard(kv);

  @Test
  void secondAttemptForTheSameClassIsRejected() {
    assertThat(guard.acquire("89990001122", "17").isNew()).isTrue();

    LockResult again = guard.acquire("89990001122", "17");
    assertThat(again.isNew()).isFalse();
    assertThat(again.message()).isEqualTo(IdempotencyGuard.ALREADY_BOOKED);

    assertThat(guard.acquire("89990001122", "18").isNew()).isTrue();
    assertThat(guard.acquire("89990003344", "17").isNew()).isTrue();
  }

  @Test
  void lockExpiresAfterTenMinutes() {
    guard.acquire("89990001122", "17");

    clock.advance(Duration.ofMinutes(10).minusSeconds(1));
    assertThat(guard.acquire("89990001122", "17").isNew()).isFalse();

    clock.advance(Duration.ofSeconds(1));
    assertThat(guard.acquire("89990001122", "17").isNew()).isTrue();
  }

  @Test
  void releaseAllowsARetry() {
    guard.acquire("89990001122", "17");
    guard.release("89990001122", "17");

    assertThat(guard.acquire("89990001122", "17").isNew()).isTrue();
  }

  @Test
  void fingerprintIsSha256HexOfPhoneAndSchedule() {
    String fp = IdempotencyGuard.fingerprint("89990001122", "17");

    assertThat(fp).hasSize(64).matches("[0-9a-f]+");
    assertThat(fp).isEqualTo(IdempotencyGuard.fingerprint("89990001122", "17"));
    assertThat(IdempotencyGuard.key("89990001122", "17")).isEqualTo("idempotency:" + fp);
  }

  @Test
  void concurrentAttemptsYieldExactlyOneWinner() throws Exception {
    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return guard.acquire("89990001122", "17").isNew();
                }));
      }
      start.countDown();

      int winners = 0;
      for (Future<Boolean> f : results) {
        if (f.get()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
