package com.studiobooking.orchestrator.dialogue;

import com.studiobooking.orchestrator.config.StudioProperties;
import com.studiobooking.orchestrator.session.SlotValues;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Confirmation summary and booking receipt texts. */
@Component
@RequiredArgsConstructor
public class ReceiptRenderer {

  static final int MAX_RECEIPT_LENGTH = 300;
  private static final String ELLIPSIS = "...";
  private static final String NOT_SET = "не указано";
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

  private final StudioProperties studio;

  public String summary(SlotValues slots) {
    return "Подтвердите запись:\n\n"
        + "Направление: "
        + orNotSet(slots.getGroup())
        + "\nДата и время: "
        + dateTime(slots)
        + "\nИмя: "
        + orNotSet(slots.getClientName())
        + "\nТелефон: "
        + orNotSet(slots.getClientPhone())
        + "\n\nПодтверждаете? (да/нет)";
  }

  /**
   * At most {@value #MAX_RECEIPT_LENGTH} characters. The address is shortened first; the whole text
   * is cut only if that is not enough.
   */
  public String receipt(SlotValues slots, String name, String phone, long reservationId) {
    String address = studio.address() == null ? "" : studio.address();
    String full = receiptText(slots, name, phone, address, reservationId);
    if (full.length() <= MAX_RECEIPT_LENGTH) {
      return full;
    }
    int withoutAddress = full.length() - address.length();
    int room = MAX_RECEIPT_LENGTH - withoutAddress - ELLIPSIS.length();
    if (room > 0) {
      return receiptText(
          slots, name, phone, address.substring(0, room) + ELLIPSIS, reservationId);
    }
    return full.substring(0, MAX_RECEIPT_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
  }

  private String receiptText(
      SlotValues slots, String name, String phone, String address, long reservationId) {
    return "✅ Запись подтверждена!\n\n"
        + "Направление: "
        + orNotSet(slots.getGroup())
        + "\nДата и время: "
        + dateTime(slots)
        + "\nИмя: "
        + orNotSet(name)
        + "\nТелефон: "
        + orNotSet(phone)
        + "\nАдрес: "
        + address
        + "\n\nНомер записи: "
        + reservationId
        + "\nНапомню за день до занятия!";
  }

  /** Stored values come back in UTC; always shown in studio time. */
  String dateTime(SlotValues slots) {
    OffsetDateTime resolved = slots.getDatetimeResolved();
    if (resolved != null) {
      return resolved.atZoneSameInstant(studio.timezone()).format(DATE_TIME);
    }
    return orNotSet(slots.getDatetimeRaw());
  }

  private static String orNotSet(String s) {
    return s == null || s.isBlank() ? NOT_SET : s;
  }
}
