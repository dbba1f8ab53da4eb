package com.studiobooking.orchestrator.idempotency;

import com.studiobooking.orchestrator.store.KeyValueStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * At most one booking commit per (phone, schedule) within the lock window. The lock is taken
 * before any mutating CRM call and released only when that call fails.
 */
@Service
@Slf4j
public class IdempotencyGuard {

  public static final String ALREADY_BOOKED = "Вы уже записаны на это занятие ✅";
  static final Duration LOCK_TTL = Duration.ofMinutes(10);

  private final KeyValueStore store;

  public IdempotencyGuard(KeyValueStore store) {
    this.store = store;
  }

  public static String fingerprint(String phone, String scheduleId) {
    try {
      MessageDigest sha = MessageDigest.getInstance("SHA-256");
      byte[] hash = sha.digest((phone + scheduleId).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public LockResult acquire(String phone, String scheduleId) {
    String key = key(phone, scheduleId);
    if (store.setIfAbsent(key, "1", LOCK_TTL)) {
      return new LockResult(true, "");
    }
    log.info("Duplicate booking attempt blocked, key={}", key);
    return new LockResult(false, ALREADY_BOOKED);
  }

  public void release(String phone, String scheduleId) {
    store.delete(key(phone, scheduleId));
  }

  static String key(String phone, String scheduleId) {
    return "idempotency:" + fingerprint(phone, scheduleId);
  }

  public record LockResult(boolean isNew, String message) {}
}
