package com.studiobooking.orchestrator.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studiobooking.orchestrator.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Per-chat session persistence.
 *
 * <p>Saves are last-write-wins. Callers that need serialization per chat wrap the whole
 * load-mutate-save cycle in {@link ChatSessionLock}.
 */
@Service
@Slf4j
public class SessionStore {

  private final KeyValueStore store;
  private final ObjectMapper mapper;
  private final ConversationStateMachine fsm;
  private final Clock clock;
  private final Duration ttl;

  public SessionStore(
      KeyValueStore store,
      ObjectMapper mapper,
      ConversationStateMachine fsm,
      Clock clock,
      @Value("${session.ttl:PT24H}") Duration ttl) {
    this.store = store;
    this.mapper = mapper;
    this.fsm = fsm;
    this.clock = clock;
    this.ttl = ttl;
  }

  static String key(String channel, String chatId) {
    return "session:" + channel + ":" + chatId;
  }

  public Optional<Session> load(String channel, String chatId) {
    Optional<String> raw = store.get(key(channel, chatId));
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      Session s = mapper.readValue(raw.get(), Session.class);
      if (s == null) {
        log.warn("Dropping empty session document {}:{}", channel, chatId);
        return Optional.empty();
      }
      if (s.getState() == null) {
        s.setState(ConversationState.IDLE);
      }
      if (s.getSlots() == null) {
        s.setSlots(new SlotValues());
      }
      return Optional.of(s);
    } catch (JsonProcessingException e) {
      log.warn("Dropping unreadable session {}:{}: {}", channel, chatId, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  public void save(Session session) {
    Instant now = clock.instant();
    Duration lifetime = fsm.getTimeout(session.getState()).orElse(ttl);
    session.setUpdatedAt(now);
    session.setExpiresAt(now.plus(lifetime));
    String json;
    try {
      json = mapper.writeValueAsString(session);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize session " + session.getChatId(), e);
    }
    store.set(key(session.getChannel(), session.getChatId()), json, lifetime);
  }

  public Session create(String traceId, String channel, String chatId) {
    return create(traceId, channel, chatId, ConversationState.IDLE);
  }

  public Session create(
      String traceId, String channel, String chatId, ConversationState initialState) {
    Session s = new Session(channel, chatId, traceIdOrNew(traceId), clock.instant());
    s.setState(initialState == null ? ConversationState.IDLE : initialState);
    save(s);
    log.info("Session created {}:{} trace={}", channel, chatId, s.getTraceId());
    return s;
  }

  /** Clears slots and history, returns to IDLE under a fresh trace id and persists. */
  public void resetToIdle(Session session) {
    resetToIdle(session, null);
  }

  public void resetToIdle(Session session, String traceId) {
    session.setState(ConversationState.IDLE);
    session.setSlots(new SlotValues());
    session.setTraceId(traceIdOrNew(traceId));
    save(session);
  }

  public Session getOrCreate(String traceId, String channel, String chatId) {
    Optional<Session> existing = load(channel, chatId);
    if (existing.isEmpty()) {
      return create(traceId, channel, chatId);
    }
    Session s = existing.get();
    if (isTimedOut(s)) {
      log.info("Session {}:{} timed out in state {}, resetting", channel, chatId, s.getState());
      resetToIdle(s, traceId);
    }
    return s;
  }

  public boolean isTimedOut(Session session) {
    Instant now = clock.instant();
    if (session.getExpiresAt() != null && now.isAfter(session.getExpiresAt())) {
      return true;
    }
    Optional<Duration> stateTimeout = fsm.getTimeout(session.getState());
    return stateTimeout.isPresent()
        && session.getUpdatedAt() != null
        && Duration.between(session.getUpdatedAt(), now).compareTo(stateTimeout.get()) > 0;
  }

  /**
   * Moves the session to {@code to} if the transition table allows it. Does not persist.
   *
   * @return false (state untouched) for an illegal transition
   */
  public boolean transition(Session session, ConversationState to) {
    ConversationState from = session.getState();
    if (from == to) {
      return true;
    }
    if (!fsm.canTransition(from, to)) {
      log.warn(
          "Rejected transition {} -> {} for {}:{}",
          from,
          to,
          session.getChannel(),
          session.getChatId());
      return false;
    }
    session.setState(to);
    return true;
  }

  private static String traceIdOrNew(String traceId) {
    return traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
  }
}
