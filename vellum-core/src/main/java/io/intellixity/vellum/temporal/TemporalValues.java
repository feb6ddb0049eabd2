package io.intellixity.vellum.temporal;

import io.intellixity.vellum.query.QueryValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parsing and canonical formatting of date, datetime and time literals.\n
 *
 * Empty values format to the sentinel minimums used as null fallbacks.
 */
public final class TemporalValues {
  public static final String FALLBACK_DATETIME = "0001-01-01 00:00:00.000000";
  public static final String FALLBACK_DATE = "0001-01-01";
  public static final String FALLBACK_TIME = "00:00:00";

  public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  public static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
  public static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

  private static final DateTimeFormatter LENIENT_DATETIME = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd")
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart()
      .appendPattern("HH:mm")
      .optionalStart().appendPattern(":ss").optionalEnd()
      .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
      .optionalEnd()
      .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
      .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
      .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
      .toFormatter();

  private TemporalValues() {}

  public static boolean isEmpty(Object value) {
    return value == null || (value instanceof String s && s.isBlank());
  }

  public static LocalDate toDate(Object value) {
    if (value instanceof LocalDate d) return d;
    return toDateTime(value).toLocalDate();
  }

  public static LocalDateTime toDateTime(Object value) {
    if (value instanceof LocalDateTime dt) return dt;
    if (value instanceof LocalDate d) return d.atStartOfDay();
    if (value instanceof OffsetDateTime odt) return odt.toLocalDateTime();
    if (value instanceof ZonedDateTime zdt) return zdt.toLocalDateTime();
    if (value instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneId.systemDefault());
    if (value instanceof java.util.Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneId.systemDefault());
    String s = String.valueOf(value).trim();
    try {
      return LocalDateTime.parse(s, LENIENT_DATETIME);
    } catch (DateTimeParseException e) {
      throw new QueryValidationException("Invalid date/datetime value: '" + s + "'", e);
    }
  }

  public static LocalTime toTime(Object value) {
    if (value instanceof LocalTime t) return t;
    if (value instanceof LocalDateTime dt) return dt.toLocalTime();
    String s = String.valueOf(value).trim();
    try {
      return LocalTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new QueryValidationException("Invalid time value: '" + s + "'", e);
    }
  }

  public static String formatDate(Object value) {
    if (isEmpty(value)) return FALLBACK_DATE;
    return DATE.format(toDate(value));
  }

  public static String formatDateTime(Object value) {
    if (isEmpty(value)) return FALLBACK_DATETIME;
    return DATETIME.format(toDateTime(value));
  }

  public static String formatTime(Object value) {
    if (isEmpty(value)) return FALLBACK_TIME;
    return TIME.format(toTime(value));
  }
}
