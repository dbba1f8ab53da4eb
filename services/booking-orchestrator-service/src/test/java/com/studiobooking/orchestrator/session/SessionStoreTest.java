package com.studiobooking.orchestrator.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.store.InMemoryKeyValueStore;
import com.studiobooking.orchestrator.support.MutableClock;
import com.studiobooking.orchestrator.support.TestJson;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStoreTest {

  private MutableClock clock;
  private InMemoryKeyValueStore kv;
  private SessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-03-10T08:00:00Z"));
    kv = new InMemoryKeyValueStore(clock);
    store =
        new SessionStore(
            kv, TestJson.mapper(), new ConversationStateMachine(), clock, Duration.ofHours(24));
  }

  @Test
  void createdSessionIsIdleAndPersistedWithDefaultTtl() {
    Session s = store.create("t-1", "telegram", "42");

    assertThat(s.getState()).isEqualTo(ConversationState.IDLE);
    assertThat(s.getTraceId()).isEqualTo("t-1");
    assertThat(kv.ttl("session:telegram:42")).isEqualTo(Duration.ofHours(24));
    assertThat(store.load("telegram", "42")).isPresent();
  }

  @Test
  void slotsAndHistorySurviveARoundTrip() {
    Session s = store.create("t-1", "telegram", "42");
    s.getSlots().setGroup("Хип-хоп");
    s.getSlots()
        .setDatetimeResolved(OffsetDateTime.of(2025, 3, 11, 19, 0, 0, 0, ZoneOffset.ofHours(10)));
    s.getSlots().setClientPhone("+79990001122");
    s.getSlots().addTurn(ChatTurn.user("привет"));
    store.transition(s, ConversationState.COLLECTING_INTENT);
    store.save(s);

    Session loaded = store.load("telegram", "42").orElseThrow();
    assertThat(loaded.getState()).isEqualTo(ConversationState.COLLECTING_INTENT);
    assertThat(loaded.getSlots().getGroup()).isEqualTo("Хип-хоп");
    assertThat(loaded.getSlots().getDatetimeResolved().toInstant())
        .isEqualTo(Instant.parse("2025-03-11T09:00:00Z"));
    assertThat(loaded.getSlots().getHistory()).containsExactly(ChatTurn.user("привет"));
  }

  @Test
  void stateTimeoutBecomesTheKeyTtl() {
    Session s = store.create("t-1", "telegram", "42", ConversationState.CONFIRM_BOOKING);

    assertThat(kv.ttl("session:telegram:42")).isEqualTo(Duration.ofHours(3));
    assertThat(s.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(3)));
  }

  @Test
  void inProgressSessionResetsAfterThirtySeconds() {
    Session s = store.create("t-1", "telegram", "42", ConversationState.BOOKING_IN_PROGRESS);
    s.getSlots().setGroup("Стрип");
    store.save(s);

    clock.advance(Duration.ofSeconds(20));
    assertThat(store.getOrCreate("t-2", "telegram", "42").getState())
        .isEqualTo(ConversationState.BOOKING_IN_PROGRESS);

    // the key itself expired after 30 s; a fresh session replaces it
    clock.advance(Duration.ofSeconds(31));
    Session after = store.getOrCreate("t-3", "telegram", "42");
    assertThat(after.getState()).isEqualTo(ConversationState.IDLE);
    assertThat(after.getSlots().getGroup()).isNull();
    assertThat(after.getTraceId()).isEqualTo("t-3");
  }

  @Test
  void timedOutSessionIsResetUnderNewTraceId() {
    Session s = store.create("t-1", "telegram", "42", ConversationState.CONFIRM_BOOKING);
    s.setExpiresAt(clock.instant().minusSeconds(1));

    assertThat(store.isTimedOut(s)).isTrue();

    store.resetToIdle(s, "t-2");
    assertThat(s.getState()).isEqualTo(ConversationState.IDLE);
    assertThat(s.getTraceId()).isEqualTo("t-2");
    assertThat(s.getSlots().missing()).hasSize(4);
  }

  @Test
  void illegalTransitionLeavesStateUnchanged() {
    Session s = store.create("t-1", "telegram", "42");

    assertThat(store.transition(s, ConversationState.BOOKING_DONE)).isFalse();
    assertThat(s.getState()).isEqualTo(ConversationState.IDLE);
    assertThat(store.transition(s, ConversationState.IDLE)).isTrue();
  }

  @Test
  void rejectedTransitionKeepsAMidDialogueState() {
    Session s = store.create("t-1", "telegram", "42");
    store.transition(s, ConversationState.COLLECTING_INTENT);
    store.transition(s, ConversationState.COLLECTING_GROUP);

    assertThat(store.transition(s, ConversationState.CONFIRM_BOOKING)).isFalse();
    assertThat(s.getState()).isEqualTo(ConversationState.COLLECTING_GROUP);
    assertThat(store.transition(s, ConversationState.BOOKING_IN_PROGRESS)).isFalse();
    assertThat(s.getState()).isEqualTo(ConversationState.COLLECTING_GROUP);
  }

  @Test
  void nullDocumentIsTreatedAsAbsent() {
    kv.set("session:telegram:42", "null", Duration.ofHours(1));

    assertThat(store.load("telegram", "42")).isEmpty();
    assertThat(store.getOrCreate("t-1", "telegram", "42").getState())
        .isEqualTo(ConversationState.IDLE);
  }

  @Test
  void unreadableSessionIsTreatedAsAbsent() {
    kv.set("session:telegram:42", "{not json", Duration.ofHours(1));

    assertThat(store.load("telegram", "42")).isEmpty();
    assertThat(store.getOrCreate("t-1", "telegram", "42").getState())
        .isEqualTo(ConversationState.IDLE);
  }

  @Test
  void historyKeepsTheLastTenTurns() {
    SlotValues slots = new SlotValues();
    for (int i = 0; i < 14; i++) {
      slots.addTurn(ChatTurn.user("m" + i));
    }
    assertThat(slots.getHistory()).hasSize(SlotValues.MAX_HISTORY);
    assertThat(slots.getHistory().get(0).text()).isEqualTo("m4");
  }

  @Test
  void clearForNextBookingKeepsContactDetails() {
    SlotValues slots = new SlotValues();
    slots.setGroup("Хип-хоп");
    slots.setDatetimeRaw("завтра");
    slots.setScheduleId(7L);
    slots.setClientName("Аня");
    slots.setClientPhone("89990001122");

    slots.clearForNextBooking();

    assertThat(slots.missing()).containsExactly(Slot.GROUP, Slot.DATETIME);
    assertThat(slots.getScheduleId()).isNull();
  }
}
