package io.intellixity.vellum.temporal;

import io.intellixity.vellum.query.Operator;
import io.intellixity.vellum.query.QueryValidationException;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves named relative windows ({@code previous "1 month"}, {@code timespan "this quarter"}) into
 * absolute date ranges relative to the injected clock.
 */
public final class DateRanges {
  private static final Map<String, String> PERIODS = Map.of(
      "1 week", "week",
      "1 month", "month",
      "3 months", "quarter",
      "6 months", "6 months",
      "1 year", "year"
  );

  private final Clock clock;
  private final DayOfWeek firstDayOfWeek;

  public DateRanges(Clock clock, DayOfWeek firstDayOfWeek) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.firstDayOfWeek = Objects.requireNonNull(firstDayOfWeek, "firstDayOfWeek");
  }

  public DateRanges(Clock clock) {
    this(clock, DayOfWeek.MONDAY);
  }

  public static DateRanges systemDefault() {
    return new DateRanges(Clock.systemDefaultZone());
  }

  public LocalDate today() {
    return LocalDate.now(clock);
  }

  /** @param op one of {@link Operator#PREVIOUS}, {@link Operator#NEXT}, {@link Operator#TIMESPAN} */
  public DateRange resolve(Operator op, Object value) {
    String v = value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
    return switch (op) {
      case PREVIOUS -> timespan("last " + period(v));
      case NEXT -> timespan("next " + period(v));
      case TIMESPAN -> timespan(v);
      default -> throw new IllegalArgumentException("Not a relative date operator: " + op);
    };
  }

  public DateRange timespan(String timespan) {
    LocalDate today = today();
    return switch (timespan) {
      case "today" -> new DateRange(today, today);
      case "yesterday" -> new DateRange(today.minusDays(1), today.minusDays(1));
      case "tomorrow" -> new DateRange(today.plusDays(1), today.plusDays(1));
      case "this week" -> week(today);
      case "last week" -> week(today.minusDays(7));
      case "next week" -> week(today.plusDays(7));
      case "this month" -> month(today);
      case "last month" -> month(today.minusMonths(1));
      case "next month" -> month(today.plusMonths(1));
      case "this quarter" -> quarter(today);
      case "last quarter" -> quarter(today.minusMonths(3));
      case "next quarter" -> quarter(today.plusMonths(3));
      case "last 6 months" -> new DateRange(quarterStart(today.minusMonths(6)), quarterEnd(today.minusMonths(3)));
      case "next 6 months" -> new DateRange(quarterStart(today.plusMonths(3)), quarterEnd(today.plusMonths(6)));
      case "this year" -> year(today);
      case "last year" -> year(today.minusYears(1));
      case "next year" -> year(today.plusYears(1));
      default -> throw new QueryValidationException("Unknown timespan: '" + timespan + "'");
    };
  }

  private static String period(String v) {
    String p = PERIODS.get(v);
    if (p == null) {
      throw new QueryValidationException("Relative period must be one of " + PERIODS.keySet() + ", got '" + v + "'");
    }
    return p;
  }

  private DateRange week(LocalDate d) {
    LocalDate start = d.with(TemporalAdjusters.previousOrSame(firstDayOfWeek));
    return new DateRange(start, start.plusDays(6));
  }

  private static DateRange month(LocalDate d) {
    return new DateRange(d.withDayOfMonth(1), d.with(TemporalAdjusters.lastDayOfMonth()));
  }

  private static DateRange quarter(LocalDate d) {
    return new DateRange(quarterStart(d), quarterEnd(d));
  }

  private static LocalDate quarterStart(LocalDate d) {
    int firstMonth = ((d.getMonthValue() - 1) / 3) * 3 + 1;
    return LocalDate.of(d.getYear(), firstMonth, 1);
  }

  private static LocalDate quarterEnd(LocalDate d) {
    return quarterStart(d).plusMonths(3).minusDays(1);
  }

  private static DateRange year(LocalDate d) {
    return new DateRange(LocalDate.of(d.getYear(), 1, 1), LocalDate.of(d.getYear(), 12, 31));
  }
}
