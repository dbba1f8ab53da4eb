package com.studiobooking.orchestrator.temporal;

import com.studiobooking.orchestrator.config.StudioProperties;
import com.studiobooking.orchestrator.temporal.TemporalResult.Confidence;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Resolves Russian date and time expressions in code, in the studio time zone. The model only
 * copies the raw expression; it never computes dates.
 */
@Component
public class RussianTemporalParser implements TemporalResolver {

  static final String UNRECOGNIZED = "Не удалось распознать дату или время";

  private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS | Pattern.CASE_INSENSITIVE;

  private static final Pattern TODAY = Pattern.compile("\\bсегодня\\b", FLAGS);
  private static final Pattern TOMORROW = Pattern.compile("\\bзавтра\\b", FLAGS);
  private static final Pattern DAY_AFTER = Pattern.compile("\\bпослезавтра\\b", FLAGS);
  private static final Pattern WEEKDAY =
      Pattern.compile(
          "\\b(?:(?:в|во|на)\\s+)?(понедельник|вторник|среду|среда|четверг|пятницу|пятница"
              + "|субботу|суббота|воскресенье)\\b",
          FLAGS);
  private static final Pattern DAY_OF_MONTH =
      Pattern.compile("\\b(?:на\\s+)?(\\d{1,2})(?:-е|-го|ого|\\s*числа)\\b", FLAGS);
  private static final Pattern DMY_DOT =
      Pattern.compile("\\b(\\d{1,2})\\.(\\d{1,2})(?:\\.(\\d{4}))?\\b");
  // "в 10.30" is a clock time, not the 10th of October
  private static final Pattern TIME_PREPOSITION = Pattern.compile("(?:^|\\s)(?:в|к)\\s+$");
  private static final Pattern DMY_SLASH = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");
  private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");

  private static final Pattern HH_COLON_MM = Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\b");
  private static final Pattern HH_DOT_MM = Pattern.compile("\\b(\\d{1,2})\\.(\\d{2})\\b");
  private static final Pattern HOURS_WORDS =
      Pattern.compile(
          "\\b(\\d{1,2})\\s*(?:часов|часа|час|ч\\.?)(?!\\p{L})"
              + "(?:\\s*(\\d{1,2})\\s*(?:минут|мин\\.?))?",
          FLAGS);
  private static final Pattern HOUR_PERIOD =
      Pattern.compile("\\b(\\d{1,2})\\s*(утра|дня|вечера)\\b", FLAGS);
  private static final Pattern EVENING = Pattern.compile("\\bвечером\\b", FLAGS);
  private static final Pattern MORNING = Pattern.compile("\\bутром\\b", FLAGS);
  private static final Pattern AFTERNOON = Pattern.compile("\\bдн[её]м\\b", FLAGS);

  private static final Map<String, DayOfWeek> WEEKDAYS =
      Map.ofEntries(
          Map.entry("понедельник", DayOfWeek.MONDAY),
          Map.entry("вторник", DayOfWeek.TUESDAY),
          Map.entry("среду", DayOfWeek.WEDNESDAY),
          Map.entry("среда", DayOfWeek.WEDNESDAY),
          Map.entry("четверг", DayOfWeek.THURSDAY),
          Map.entry("пятницу", DayOfWeek.FRIDAY),
          Map.entry("пятница", DayOfWeek.FRIDAY),
          Map.entry("субботу", DayOfWeek.SATURDAY),
          Map.entry("суббота", DayOfWeek.SATURDAY),
          Map.entry("воскресенье", DayOfWeek.SUNDAY));

  private static final DateTimeFormatter RU_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private final StudioProperties studio;
  private final Clock clock;

  public RussianTemporalParser(StudioProperties studio, Clock clock) {
    this.studio = studio;
    this.clock = clock;
  }

  @Override
  public TemporalResult parse(String text) {
    return parse(text, ZonedDateTime.now(clock.withZone(studio.timezone())));
  }

  @Override
  public TemporalResult parse(String text, ZonedDateTime now) {
    if (text == null || text.isBlank()) {
      return TemporalResult.failed(text, UNRECOGNIZED);
    }
    ZonedDateTime local = now.withZoneSameInstant(studio.timezone());
    String input = text.toLowerCase(Locale.ROOT).trim();

    DatePart datePart = parseDate(input, local.toLocalDate());
    if (datePart.error() != null) {
      return TemporalResult.failed(text, datePart.error());
    }
    // the matched date must not be read again as a time ("15.12.2025" is not 15:12)
    String rest = datePart.matched() == null ? input : input.replace(datePart.matched(), " ");
    TimePart timePart = parseTime(rest);

    if (datePart.date() != null) {
      Confidence confidence = Confidence.HIGH;
      if (timePart.time() == null || timePart.confidence() == Confidence.LOW) {
        confidence = Confidence.MEDIUM;
      }
      return new TemporalResult(datePart.date(), timePart.time(), confidence, text, null);
    }
    if (timePart.time() != null) {
      Confidence confidence =
          timePart.confidence() == Confidence.LOW ? Confidence.MEDIUM : timePart.confidence();
      return new TemporalResult(local.toLocalDate(), timePart.time(), confidence, text, null);
    }
    return TemporalResult.failed(text, UNRECOGNIZED);
  }

  private DatePart parseDate(String text, LocalDate today) {
    Matcher m = DAY_AFTER.matcher(text);
    if (m.find()) {
      return DatePart.of(today.plusDays(2), m.group());
    }
    m = TOMORROW.matcher(text);
    if (m.find()) {
      return DatePart.of(today.plusDays(1), m.group());
    }
    m = TODAY.matcher(text);
    if (m.find()) {
      return DatePart.of(today, m.group());
    }

    m = WEEKDAY.matcher(text);
    if (m.find()) {
      DayOfWeek target = WEEKDAYS.get(m.group(1));
      int ahead = target.getValue() - today.getDayOfWeek().getValue();
      if (ahead <= 0) {
        ahead += 7;
      }
      return DatePart.of(today.plusDays(ahead), m.group());
    }

    m = DAY_OF_MONTH.matcher(text);
    if (m.find()) {
      int day = Integer.parseInt(m.group(1));
      try {
        LocalDate candidate = today.withDayOfMonth(day);
        if (candidate.isBefore(today)) {
          candidate = today.plusMonths(1).withDayOfMonth(day);
        }
        return DatePart.of(candidate, m.group());
      } catch (DateTimeException e) {
        return DatePart.error("Неверная дата: " + day + " число");
      }
    }

    for (Pattern p : new Pattern[] {DMY_DOT, DMY_SLASH, ISO}) {
      m = p.matcher(text);
      while (m.find()) {
        LocalDate date;
        try {
          if (p == ISO) {
            date = LocalDate.of(num(m, 1), num(m, 2), num(m, 3));
          } else if (m.group(3) == null) {
            if (TIME_PREPOSITION.matcher(text.substring(0, m.start())).find()) {
              continue;
            }
            date = LocalDate.of(today.getYear(), num(m, 2), num(m, 1));
            if (date.isBefore(today)) {
              date = date.plusYears(1);
            }
          } else {
            date = LocalDate.of(num(m, 3), num(m, 2), num(m, 1));
          }
        } catch (DateTimeException e) {
          continue;
        }
        if (date.isBefore(today)) {
          return DatePart.error(
              "Прошедшая дата: " + date.format(RU_DATE) + ". Предлагаю ближайшее занятие.");
        }
        return DatePart.of(date, m.group());
      }
    }
    return DatePart.none();
  }

  private TimePart parseTime(String text) {
    for (Pattern p : new Pattern[] {HH_COLON_MM, HH_DOT_MM, HOURS_WORDS}) {
      Matcher m = p.matcher(text);
      while (m.find()) {
        int hour = num(m, 1);
        int minute = m.group(2) == null ? 0 : num(m, 2);
        if (hour <= 23 && minute <= 59) {
          return new TimePart(LocalTime.of(hour, minute), Confidence.HIGH);
        }
      }
    }

    Matcher m = HOUR_PERIOD.matcher(text);
    if (m.find()) {
      int hour = num(m, 1);
      if (hour >= 1 && hour <= 12) {
        switch (m.group(2)) {
          case "утра":
            hour = hour == 12 ? 0 : hour;
            break;
          case "вечера":
            hour = hour == 12 ? 0 : hour + 12;
            break;
          default:
            // дня: 12 дня is noon
            hour = hour == 12 ? 12 : hour + 12;
            break;
        }
        return new TimePart(LocalTime.of(hour, 0), Confidence.HIGH);
      }
    }

    if (EVENING.matcher(text).find()) {
      return new TimePart(LocalTime.of(19, 0), Confidence.LOW);
    }
    if (MORNING.matcher(text).find()) {
      return new TimePart(LocalTime.of(10, 0), Confidence.LOW);
    }
    if (AFTERNOON.matcher(text).find()) {
      return new TimePart(LocalTime.of(14, 0), Confidence.LOW);
    }
    return new TimePart(null, Confidence.LOW);
  }

  private static int num(Matcher m, int group) {
    return Integer.parseInt(m.group(group));
  }

  private record DatePart(LocalDate date, String matched, String error) {

    static DatePart of(LocalDate date, String matched) {
      return new DatePart(date, matched, null);
    }

    static DatePart error(String error) {
      return new DatePart(null, null, error);
    }

    static DatePart none() {
      return new DatePart(null, null, null);
    }
  }

  private record TimePart(LocalTime time, Confidence confidence) {}
}
