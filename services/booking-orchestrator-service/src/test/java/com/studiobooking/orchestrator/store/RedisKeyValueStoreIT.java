package com.studiobooking.orchestrator.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.store.KeyValueStore.CounterUpdate;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class RedisKeyValueStoreIT {

  @Container
  static final GenericContainer<?> redis =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  @DynamicPropertySource
  static void props(DynamicPropertyRegistry r) {
    r.add("spring.data.redis.host", redis::getHost);
    r.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
  }

  @Autowired KeyValueStore store;

  @Autowired StringRedisTemplate template;

  @BeforeEach
  void flush() {
    template.getConnectionFactory().getConnection().serverCommands().flushAll();
  }

  @Test
  void incrementWithinLimitStopsAtTheLimit() {
    Duration ttl = Duration.ofMinutes(2);

    assertThat(store.incrementWithinLimit("budget:t", 60, 100, ttl))
        .isEqualTo(new CounterUpdate(true, 60));
    assertThat(store.incrementWithinLimit("budget:t", 40, 100, ttl))
        .isEqualTo(new CounterUpdate(true, 100));
    assertThat(store.incrementWithinLimit("budget:t", 1, 100, ttl))
        .isEqualTo(new CounterUpdate(false, 100));
    assertThat(store.get("budget:t")).contains("100");
    assertThat(template.getExpire("budget:t")).isPositive();
  }

  @Test
  void rejectedIncrementOnMissingKeyCreatesNothing() {
    assertThat(store.incrementWithinLimit("budget:x", 5, 1, Duration.ofMinutes(1)).accepted())
        .isFalse();
    assertThat(store.get("budget:x")).isEmpty();
  }

  @Test
  void setIfAbsentIsExclusive() {
    assertThat(store.setIfAbsent("idempotency:1", "a", Duration.ofHours(24))).isTrue();
    assertThat(store.setIfAbsent("idempotency:1", "b", Duration.ofHours(24))).isFalse();
    assertThat(store.get("idempotency:1")).contains("a");
  }

  @Test
  void deleteIfEqualsOnlyRemovesTheExpectedValue() {
    store.set("lock:session:telegram:1", "token-b", Duration.ofSeconds(35));

    assertThat(store.deleteIfEquals("lock:session:telegram:1", "token-a")).isFalse();
    assertThat(store.get("lock:session:telegram:1")).contains("token-b");
    assertThat(store.deleteIfEquals("lock:session:telegram:1", "token-b")).isTrue();
    assertThat(store.get("lock:session:telegram:1")).isEmpty();
  }

  @Test
  void deleteByPatternRemovesOnlyMatchingKeys() {
    store.set("crm:cache:schedule:a", "1", Duration.ofMinutes(15));
    store.set("crm:cache:schedule:b", "1", Duration.ofMinutes(15));
    store.set("crm:cache:groups", "1", Duration.ofHours(1));

    assertThat(store.deleteByPattern("crm:cache:schedule:*")).isEqualTo(2);
    assertThat(store.get("crm:cache:groups")).isPresent();
  }

  @Test
  void listBehavesAsFifo() {
    store.leftPush("crm:fallback:queue", "first");
    store.leftPush("crm:fallback:queue", "second");

    assertThat(store.listSize("crm:fallback:queue")).isEqualTo(2);
    assertThat(store.rightPop("crm:fallback:queue")).contains("first");
    assertThat(store.rightPop("crm:fallback:queue")).contains("second");
    assertThat(store.rightPop("crm:fallback:queue")).isEmpty();
  }

  @Test
  void pingAnswers() {
    assertThat(store.ping()).isTrue();
  }
}
