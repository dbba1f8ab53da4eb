package com.studiobooking.orchestrator.temporal;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.config.StudioProperties;
import com.studiobooking.orchestrator.temporal.TemporalResult.Confidence;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class RussianTemporalParserTest {

  private static final ZoneId VLADIVOSTOK = ZoneId.of("Asia/Vladivostok");
  // Monday
  private static final ZonedDateTime NOW = ZonedDateTime.of(2025, 3, 10, 10, 0, 0, 0, VLADIVOSTOK);

  private final RussianTemporalParser parser =
      new RussianTemporalParser(
          new StudioProperties("Студия", "", "", VLADIVOSTOK, LocalTime.of(19, 0)),
          Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));

  @Test
  void tomorrowWithExactTime() {
    TemporalResult r = parser.parse("завтра в 19:00", NOW);

    assertThat(r.date()).isEqualTo(LocalDate.of(2025, 3, 11));
    assertThat(r.time()).isEqualTo(LocalTime.of(19, 0));
    assertThat(r.confidence()).isEqualTo(Confidence.HIGH);
    assertThat(r.isResolved()).isTrue();
  }

  @Test
  void relativeDaysWithoutTime() {
    assertThat(parser.parse("сегодня", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 10));
    TemporalResult r = parser.parse("Послезавтра", NOW);
    assertThat(r.date()).isEqualTo(LocalDate.of(2025, 3, 12));
    assertThat(r.time()).isNull();
    assertThat(r.confidence()).isEqualTo(Confidence.MEDIUM);
  }

  @Test
  void weekdayIsTheNextOccurrence() {
    assertThat(parser.parse("в среду", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 12));
    assertThat(parser.parse("пятница 18:30", NOW).time()).isEqualTo(LocalTime.of(18, 30));
    // same weekday as today means next week
    assertThat(parser.parse("в понедельник", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 17));
    assertThat(parser.parse("во вторник", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 11));
  }

  @Test
  void vagueTimeOfDayLowersConfidence() {
    TemporalResult r = parser.parse("в среду вечером", NOW);

    assertThat(r.time()).isEqualTo(LocalTime.of(19, 0));
    assertThat(r.confidence()).isEqualTo(Confidence.MEDIUM);
  }

  @Test
  void dayOfMonthRollsIntoNextMonthWhenPassed() {
    assertThat(parser.parse("на 15-е", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 15));
    assertThat(parser.parse("на 5-е", NOW).date()).isEqualTo(LocalDate.of(2025, 4, 5));
    assertThat(parser.parse("20 числа", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 20));
  }

  @Test
  void impossibleDayOfMonthIsAnError() {
    ZonedDateTime february = ZonedDateTime.of(2025, 2, 10, 10, 0, 0, 0, VLADIVOSTOK);

    TemporalResult r = parser.parse("на 30-е", february);

    assertThat(r.isResolved()).isFalse();
    assertThat(r.error()).isEqualTo("Неверная дата: 30 число");
  }

  @Test
  void absoluteDatesAreNotReadAsTimes() {
    TemporalResult r = parser.parse("15.12.2025 в 18.30", NOW);

    assertThat(r.date()).isEqualTo(LocalDate.of(2025, 12, 15));
    assertThat(r.time()).isEqualTo(LocalTime.of(18, 30));
    assertThat(parser.parse("20/03/2025", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 20));
    assertThat(parser.parse("2025-03-21", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 21));
  }

  @Test
  void dayAndMonthWithoutYear() {
    TemporalResult dateOnly = parser.parse("15.03", NOW);
    assertThat(dateOnly.date()).isEqualTo(LocalDate.of(2025, 3, 15));
    assertThat(dateOnly.time()).isNull();
    assertThat(dateOnly.confidence()).isEqualTo(Confidence.MEDIUM);

    TemporalResult withTime = parser.parse("15.03 в 19:00", NOW);
    assertThat(withTime.date()).isEqualTo(LocalDate.of(2025, 3, 15));
    assertThat(withTime.time()).isEqualTo(LocalTime.of(19, 0));
    assertThat(withTime.confidence()).isEqualTo(Confidence.HIGH);
  }

  @Test
  void passedDayAndMonthMeansNextYear() {
    TemporalResult r = parser.parse("01.03", NOW);

    assertThat(r.error()).isNull();
    assertThat(r.date()).isEqualTo(LocalDate.of(2026, 3, 1));
  }

  @Test
  void dottedTimeAfterPrepositionStaysATime() {
    TemporalResult r = parser.parse("в 10.30", NOW);

    assertThat(r.date()).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(r.time()).isEqualTo(LocalTime.of(10, 30));
    assertThat(parser.parse("в 15.03.2025", NOW).date()).isEqualTo(LocalDate.of(2025, 3, 15));
  }

  @Test
  void pastExplicitDateIsRejected() {
    TemporalResult r = parser.parse("01.03.2025", NOW);

    assertThat(r.isResolved()).isFalse();
    assertThat(r.error()).isEqualTo("Прошедшая дата: 01.03.2025. Предлагаю ближайшее занятие.");
  }

  @Test
  void timeOnlyMeansToday() {
    TemporalResult r = parser.parse("в 7 вечера", NOW);

    assertThat(r.date()).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(r.time()).isEqualTo(LocalTime.of(19, 0));
    assertThat(parser.parse("12 дня", NOW).time()).isEqualTo(LocalTime.of(12, 0));
    assertThat(parser.parse("9 утра", NOW).time()).isEqualTo(LocalTime.of(9, 0));
    assertThat(parser.parse("в 18 часов 30 минут", NOW).time()).isEqualTo(LocalTime.of(18, 30));
  }

  @Test
  void unrecognizedText() {
    assertThat(parser.parse("когда-нибудь потом", NOW).error())
        .isEqualTo(RussianTemporalParser.UNRECOGNIZED);
    assertThat(parser.parse("в 25:00", NOW).isResolved()).isFalse();
    assertThat(parser.parse("  ", NOW).isResolved()).isFalse();
  }

  @Test
  void defaultClassTimeAppliesWhenOnlyTheDateIsKnown() {
    TemporalResult r = parser.parse("завтра", NOW);

    assertThat(r.toDateTime(VLADIVOSTOK, LocalTime.of(19, 0)))
        .contains(ZonedDateTime.of(2025, 3, 11, 19, 0, 0, 0, VLADIVOSTOK));
  }

  @Test
  void nowDefaultsToTheClockInTheStudioZone() {
    // 23:30 UTC on the 9th is already the 10th in Vladivostok
    RussianTemporalParser late =
        new RussianTemporalParser(
            new StudioProperties("Студия", "", "", VLADIVOSTOK, LocalTime.of(19, 0)),
            Clock.fixed(Instant.parse("2025-03-09T23:30:00Z"), ZoneOffset.UTC));

    assertThat(late.parse("сегодня").date()).isEqualTo(LocalDate.of(2025, 3, 10));
  }
}
