package io.rapitapir.types.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient date and date-time parsing for loosely formatted input.\n
 *
 * Accepted forms (tried in order):\n
 * - ISO-8601 with offset, zone id, or neither\n
 * - {@code yyyy-MM-dd HH:mm[:ss]} with optional offset\n
 * - RFC-1123 ({@code Tue, 3 Jun 2008 11:05:30 GMT})\n
 * - ISO dates, basic ISO ({@code 20240115}), {@code yyyy/M/d}\n
 * - English month names ({@code Jan 15, 2024}, {@code 15 January 2024})\n
 *
 * A date-time string parses as a date (the date part is kept) and a bare date parses as a
 * date-time at the start of the day.\n
 */
public final class TemporalParsing {
  private TemporalParsing() {}

  private static final List<DateTimeFormatter> OFFSET_DATE_TIMES = List.of(
      DateTimeFormatter.ISO_OFFSET_DATE_TIME,
      DateTimeFormatter.RFC_1123_DATE_TIME,
      insensitive("uuuu-MM-dd HH:mm[:ss][.SSS]XXX")
  );

  private static final List<DateTimeFormatter> LOCAL_DATE_TIMES = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      insensitive("uuuu-MM-dd HH:mm[:ss][.SSS]")
  );

  private static final List<DateTimeFormatter> DATES = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.BASIC_ISO_DATE,
      insensitive("uuuu/M/d"),
      insensitive("MMM d, uuuu"),
      insensitive("MMMM d, uuuu"),
      insensitive("d MMM uuuu"),
      insensitive("d MMMM uuuu"),
      insensitive("EEE, d MMM uuuu"),
      insensitive("EEEE, MMMM d, uuuu")
  );

  public static Optional<LocalDate> parseDate(String text) {
    if (text == null || text.isBlank()) return Optional.empty();
    String s = text.trim();
    for (DateTimeFormatter f : DATES) {
      Optional<LocalDate> d = attempt(() -> LocalDate.parse(s, f));
      if (d.isPresent()) return d;
    }
    return parseDateTimeOnly(s, ZoneOffset.UTC).map(OffsetDateTime::toLocalDate);
  }

  public static Optional<OffsetDateTime> parseDateTime(String text, ZoneId zone) {
    if (text == null || text.isBlank()) return Optional.empty();
    String s = text.trim();
    Optional<OffsetDateTime> dt = parseDateTimeOnly(s, zone);
    if (dt.isPresent()) return dt;
    for (DateTimeFormatter f : DATES) {
      Optional<LocalDate> d = attempt(() -> LocalDate.parse(s, f));
      if (d.isPresent()) return Optional.of(atStartOfDay(d.get(), zone));
    }
    return Optional.empty();
  }

  public static boolean isDate(String text) {
    return parseDate(text).isPresent();
  }

  public static boolean isDateTime(String text) {
    return parseDateTime(text, ZoneOffset.UTC).isPresent();
  }

  public static OffsetDateTime atStartOfDay(LocalDate date, ZoneId zone) {
    return date.atStartOfDay(zone).toOffsetDateTime();
  }

  public static OffsetDateTime atZone(LocalDateTime dateTime, ZoneId zone) {
    return dateTime.atZone(zone).toOffsetDateTime();
  }

  /**
   * Strict formatter for a user-supplied {@link DateTimeFormatter} pattern. Year-of-era letters
   * ({@code yyyy}) resolve in the current era.
   *
   * @throws IllegalArgumentException when the pattern is malformed
   */
  public static DateTimeFormatter strictPattern(String pattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.ERA, 1)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  /** Date parsed with a {@link #strictPattern(String)} formatter; empty when it holds no full date. */
  public static Optional<LocalDate> parseDate(String text, DateTimeFormatter formatter) {
    if (text == null) return Optional.empty();
    return attempt(() -> LocalDate.from(formatter.parse(text.trim())));
  }

  /**
   * Date-time parsed with a {@link #strictPattern(String)} formatter. A parsed offset or zone is
   * kept, a local date-time is placed in {@code zone}, a bare date starts the day.
   */
  public static Optional<OffsetDateTime> parseDateTime(String text, DateTimeFormatter formatter, ZoneId zone) {
    if (text == null) return Optional.empty();
    Optional<TemporalAccessor> parsed = attempt(() -> formatter.parse(text.trim()));
    if (parsed.isEmpty()) return Optional.empty();
    TemporalAccessor t = parsed.get();
    Optional<OffsetDateTime> dt = attempt(() -> OffsetDateTime.from(t));
    if (dt.isPresent()) return dt;
    dt = attempt(() -> atZone(LocalDateTime.from(t), zone));
    if (dt.isPresent()) return dt;
    return attempt(() -> atStartOfDay(LocalDate.from(t), zone));
  }

  /** True when {@code text} parses completely with {@code formatter}. */
  public static boolean matches(String text, DateTimeFormatter formatter) {
    return attempt(() -> formatter.parse(text)).isPresent();
  }

  private static Optional<OffsetDateTime> parseDateTimeOnly(String s, ZoneId zone) {
    for (DateTimeFormatter f : OFFSET_DATE_TIMES) {
      Optional<OffsetDateTime> dt = attempt(() -> OffsetDateTime.parse(s, f));
      if (dt.isPresent()) return dt;
    }
    Optional<OffsetDateTime> zoned = attempt(() -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME))
        .map(ZonedDateTime::toOffsetDateTime);
    if (zoned.isPresent()) return zoned;
    for (DateTimeFormatter f : LOCAL_DATE_TIMES) {
      Optional<OffsetDateTime> dt = attempt(() -> atZone(LocalDateTime.parse(s, f), zone));
      if (dt.isPresent()) return dt;
    }
    return Optional.empty();
  }

  private static <T> Optional<T> attempt(ParseStep<T> step) {
    try {
      return Optional.of(step.parse());
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter insensitive(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  @FunctionalInterface
  private interface ParseStep<T> {
    T parse();
  }
}
