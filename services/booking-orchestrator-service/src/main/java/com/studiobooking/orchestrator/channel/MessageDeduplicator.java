package com.studiobooking.orchestrator.channel;

import com.studiobooking.orchestrator.store.KeyValueStore;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Drops webhook redeliveries of a message that was already taken for processing. */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageDeduplicator {

  static final Duration SEEN_TTL = Duration.ofMinutes(5);

  private final KeyValueStore store;

  /**
   * @return true the first time a message id is seen on a channel. Store failures let the message
   *     through.
   */
  public boolean firstDelivery(String channel, String messageId) {
    if (messageId == null || messageId.isBlank()) {
      return true;
    }
    try {
      return store.setIfAbsent(key(channel, messageId), "1", SEEN_TTL);
    } catch (RuntimeException e) {
      log.warn("Dedup check failed for {}:{}: {}", channel, messageId, e.getMessage());
      return true;
    }
  }

  static String key(String channel, String messageId) {
    return "seen:" + channel + ":" + messageId;
  }
}
