package com.studiobooking.orchestrator.session;

import com.studiobooking.orchestrator.store.KeyValueStore;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Short-lived advisory lock around the processing of one message in a chat. Off unless {@code
 * session.serialize-per-chat=true}.
 */
@Component
@Slf4j
public class ChatSessionLock {

  private final KeyValueStore store;
  private final boolean enabled;
  private final Duration ttl;

  public ChatSessionLock(
      KeyValueStore store,
      @Value("${session.serialize-per-chat:false}") boolean enabled,
      @Value("${session.chat-lock-ttl:PT35S}") Duration ttl) {
    this.store = store;
    this.enabled = enabled;
    this.ttl = ttl;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * @return the lock token, or empty when another message of the same chat holds the lock. Always
   *     returns a token when locking is disabled.
   */
  public Optional<String> tryLock(String channel, String chatId) {
    String token = UUID.randomUUID().toString();
    if (!enabled) {
      return Optional.of(token);
    }
    if (store.setIfAbsent(key(channel, chatId), token, ttl)) {
      return Optional.of(token);
    }
    log.info("Chat {}:{} is busy, message not processed", channel, chatId);
    return Optional.empty();
  }

  public void unlock(String channel, String chatId, String token) {
    if (!enabled) {
      return;
    }
    // a lock that expired and was taken by the next message is not ours to delete
    if (!store.deleteIfEquals(key(channel, chatId), token)) {
      log.debug("Lock of chat {}:{} already expired", channel, chatId);
    }
  }

  static String key(String channel, String chatId) {
    return "lock:session:" + channel + ":" + chatId;
  }
}
