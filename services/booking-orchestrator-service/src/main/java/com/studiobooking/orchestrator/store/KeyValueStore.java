package com.studiobooking.orchestrator.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value namespace used by sessions, locks, budget counters, CRM cache and the fallback
 * queue.
 *
 * <p>Every instance of the service talks to the same namespace, so anything that must hold across
 * instances (locks, counters) has to go through the atomic operations declared here.
 */
public interface KeyValueStore {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /**
   * Atomic set-if-absent.
   *
   * @return true if the key was created by this call
   */
  boolean setIfAbsent(String key, String value, Duration ttl);

  boolean delete(String key);

  /** Atomic compare-and-delete: removes the key only while it still holds {@code expected}. */
  boolean deleteIfEquals(String key, String expected);

  boolean expire(String key, Duration ttl);

  /** Deletes every key matching a glob pattern ({@code crm:cache:schedule:*}). */
  long deleteByPattern(String pattern);

  /** Unconditional increment; the TTL is (re)applied after the increment. */
  long increment(String key, long amount, Duration ttl);

  /**
   * Atomic check-and-increment: increments by {@code amount} only if the result stays within
   * {@code limit}. On rejection the TTL of an existing key is refreshed and the value is left
   * untouched.
   */
  CounterUpdate incrementWithinLimit(String key, long amount, long limit, Duration ttl);

  long leftPush(String key, String value);

  Optional<String> rightPop(String key);

  long listSize(String key);

  boolean ping();

  record CounterUpdate(boolean accepted, long value) {}
}
