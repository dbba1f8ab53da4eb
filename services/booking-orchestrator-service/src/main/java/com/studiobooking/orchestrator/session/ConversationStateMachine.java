package com.studiobooking.orchestrator.session;

import static com.studiobooking.orchestrator.session.ConversationState.*;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Transition and timeout tables of the booking dialogue. No I/O. */
@Component
public class ConversationStateMachine {

  /** States a multi-step advance may pass through without the user noticing. */
  private static final Set<ConversationState> SLOT_STATES =
      EnumSet.of(COLLECTING_GROUP, COLLECTING_DATETIME, COLLECTING_CONTACT);

  private final Map<ConversationState, Set<ConversationState>> transitions =
      new EnumMap<>(ConversationState.class);
  private final Map<ConversationState, Duration> timeouts = new EnumMap<>(ConversationState.class);

  public ConversationStateMachine() {
    allow(IDLE, COLLECTING_INTENT, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    // the two contact/datetime edges let a multi-slot answer skip ahead
    allow(
        COLLECTING_INTENT,
        BROWSING_SCHEDULE,
        COLLECTING_GROUP,
        COLLECTING_DATETIME,
        COLLECTING_CONTACT,
        IDLE,
        CANCEL_FLOW,
        HANDOFF_TO_ADMIN);
    allow(BROWSING_SCHEDULE, COLLECTING_GROUP, IDLE, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    allow(COLLECTING_GROUP, COLLECTING_DATETIME, IDLE, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    allow(COLLECTING_DATETIME, COLLECTING_CONTACT, IDLE, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    allow(COLLECTING_CONTACT, CONFIRM_BOOKING, IDLE, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    allow(CONFIRM_BOOKING, BOOKING_IN_PROGRESS, IDLE, CANCEL_FLOW, HANDOFF_TO_ADMIN);
    allow(BOOKING_IN_PROGRESS, BOOKING_DONE, IDLE, HANDOFF_TO_ADMIN);
    allow(BOOKING_DONE, IDLE, SERIAL_BOOKING);
    allow(CANCEL_FLOW, IDLE, HANDOFF_TO_ADMIN);
    allow(SERIAL_BOOKING, COLLECTING_GROUP, IDLE, HANDOFF_TO_ADMIN);
    allow(HANDOFF_TO_ADMIN, ADMIN_RESPONDING, IDLE);
    allow(ADMIN_RESPONDING, IDLE);

    timeouts.put(CONFIRM_BOOKING, Duration.ofHours(3));
    timeouts.put(BOOKING_IN_PROGRESS, Duration.ofSeconds(30));
    timeouts.put(ADMIN_RESPONDING, Duration.ofHours(4));
  }

  private void allow(ConversationState from, ConversationState... to) {
    Set<ConversationState> set = EnumSet.noneOf(ConversationState.class);
    Collections.addAll(set, to);
    transitions.put(from, set);
  }

  public boolean canTransition(ConversationState from, ConversationState to) {
    if (from == null || to == null) {
      return false;
    }
    return transitions.getOrDefault(from, Set.of()).contains(to);
  }

  public Set<ConversationState> allowedFrom(ConversationState from) {
    return Collections.unmodifiableSet(transitions.getOrDefault(from, Set.of()));
  }

  /** State-specific timeout, empty when only the default session lifetime applies. */
  public Optional<Duration> getTimeout(ConversationState state) {
    return Optional.ofNullable(timeouts.get(state));
  }

  public Optional<Long> getTimeoutSeconds(ConversationState state) {
    return getTimeout(state).map(Duration::toSeconds);
  }

  public boolean isTerminal(ConversationState state) {
    return state == BOOKING_DONE;
  }

  public boolean isPersistent(ConversationState state) {
    return state == HANDOFF_TO_ADMIN || state == ADMIN_RESPONDING;
  }

  /**
   * Shortest chain of legal transitions from {@code from} to {@code to} whose intermediate states
   * are slot-collection states only. The returned list excludes {@code from} and ends with {@code
   * to}; it is empty when no such chain exists or when {@code from == to}.
   */
  public List<ConversationState> pathTo(ConversationState from, ConversationState to) {
    if (from == null || to == null || from == to) {
      return List.of();
    }
    Map<ConversationState, ConversationState> parent = new EnumMap<>(ConversationState.class);
    Deque<ConversationState> queue = new ArrayDeque<>();
    queue.add(from);
    parent.put(from, from);
    while (!queue.isEmpty()) {
      ConversationState cur = queue.poll();
      for (ConversationState next : allowedFrom(cur)) {
        if (parent.containsKey(next)) {
          continue;
        }
        parent.put(next, cur);
        if (next == to) {
          return unwind(parent, from, to);
        }
        if (SLOT_STATES.contains(next)) {
          queue.add(next);
        }
      }
    }
    return List.of();
  }

  private static List<ConversationState> unwind(
      Map<ConversationState, ConversationState> parent,
      ConversationState from,
      ConversationState to) {
    List<ConversationState> path = new ArrayList<>();
    for (ConversationState s = to; s != from; s = parent.get(s)) {
      path.add(s);
    }
    Collections.reverse(path);
    return path;
  }
}
