package com.studiobooking.orchestrator.channel;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.store.InMemoryKeyValueStore;
import com.studiobooking.orchestrator.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MessageDeduplicatorTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T00:00:00Z"));
  private final MessageDeduplicator dedup =
      new MessageDeduplicator(new InMemoryKeyValueStore(clock));

  @Test
  void sameMessageIdIsSeenOncePerChannelWithinFiveMinutes() {
    assertThat(dedup.firstDelivery("telegram", "10")).isTrue();
    assertThat(dedup.firstDelivery("telegram", "10")).isFalse();
    assertThat(dedup.firstDelivery("whatsapp", "10")).isTrue();

    clock.advance(Duration.ofMinutes(5));
    assertThat(dedup.firstDelivery("telegram", "10")).isTrue();
  }

  @Test
  void messagesWithoutIdAreNeverDropped() {
    assertThat(dedup.firstDelivery("telegram", null)).isTrue();
    assertThat(dedup.firstDelivery("telegram", null)).isTrue();
  }
}
