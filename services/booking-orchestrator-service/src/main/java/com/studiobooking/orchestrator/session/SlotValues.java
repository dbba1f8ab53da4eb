package com.studiobooking.orchestrator.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Values collected during one booking dialogue.
 *
 * <p>{@code datetimeResolved} is only ever written from the temporal resolver output for {@code
 * datetimeRaw}. Jackson normalizes it to UTC on read, so callers convert it to the studio zone
 * before formatting.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlotValues {

  public static final int MAX_HISTORY = 10;

  private String group;
  private String datetimeRaw;
  private OffsetDateTime datetimeResolved;
  private String clientName;
  private String clientPhone;
  private Long scheduleId;
  private List<ChatTurn> history = new ArrayList<>();

  public void addTurn(ChatTurn turn) {
    if (history == null) {
      history = new ArrayList<>();
    }
    history.add(turn);
    while (history.size() > MAX_HISTORY) {
      history.remove(0);
    }
  }

  public List<ChatTurn> recentHistory() {
    return history == null ? List.of() : List.copyOf(history);
  }

  /** Required slots still empty, in asking order. */
  public List<Slot> missing() {
    List<Slot> out = new ArrayList<>();
    if (isBlank(group)) {
      out.add(Slot.GROUP);
    }
    if (datetimeResolved == null) {
      out.add(Slot.DATETIME);
    }
    if (isBlank(clientName)) {
      out.add(Slot.NAME);
    }
    if (isBlank(clientPhone)) {
      out.add(Slot.PHONE);
    }
    return out;
  }

  public boolean hasAllRequired() {
    return missing().isEmpty();
  }

  /** Drops everything collected for the current booking but keeps who the client is. */
  public void clearForNextBooking() {
    group = null;
    datetimeRaw = null;
    datetimeResolved = null;
    scheduleId = null;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
