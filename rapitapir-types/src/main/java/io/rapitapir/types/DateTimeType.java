package io.rapitapir.types;

import io.rapitapir.types.config.TypesConfig;
import io.rapitapir.types.util.TemporalParsing;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Point in time with offset; coerces to {@link OffsetDateTime}. Offset-less input is placed in the
 * configured zone ({@link TypesConfig#zone()}).
 */
public final class DateTimeType extends BaseType {
  public static final String ISO8601 = "iso8601";
  public static final String RFC3339 = "rfc3339";

  private static final Pattern ISO_DATE_TIME =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})$");

  final String format;
  private final DateTimeFormatter custom;

  DateTimeType(Attributes attrs, String format) {
    super(attrs);
    this.format = format;
    this.custom = format == null || ISO8601.equalsIgnoreCase(format) || RFC3339.equalsIgnoreCase(format)
        ? null
        : TemporalParsing.strictPattern(format);
  }

  public String format() { return format; }

  public DateTimeType withFormat(String format) {
    return new DateTimeType(attrs, format);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new DateTimeType(attrs, format);
  }

  @Override String typeName() { return "DateTime"; }
  @Override String jsonType() { return "string"; }

  @Override
  List<String> validateType(Object value) {
    if (value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof LocalDateTime
        || value instanceof Instant || value instanceof java.util.Date) {
      return List.of();
    }
    if (value instanceof String s && (TemporalParsing.isDateTime(s) || custom != null && TemporalParsing.matches(s, custom))) {
      return List.of();
    }
    return List.of("Expected DateTime, Time, or datetime string, got " + Values.typeName(value));
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (format == null || !(value instanceof String s)) return List.of();
    if (custom != null) {
      return TemporalParsing.matches(s, custom) ? List.of() : List.of("DateTime does not match format " + format);
    }
    if (ISO_DATE_TIME.matcher(s).matches()) return List.of();
    return List.of(RFC3339.equalsIgnoreCase(format)
        ? "DateTime must be in RFC3339 format"
        : "DateTime must be in ISO8601 format");
  }

  @Override
  Object coerceValue(Object value) {
    ZoneId zone = TypesConfig.global().zone();
    if (value instanceof OffsetDateTime dt) return dt;
    if (value instanceof ZonedDateTime dt) return dt.toOffsetDateTime();
    if (value instanceof LocalDateTime dt) return TemporalParsing.atZone(dt, zone);
    if (value instanceof LocalDate d) return TemporalParsing.atStartOfDay(d, zone);
    if (value instanceof java.sql.Date d) return TemporalParsing.atStartOfDay(d.toLocalDate(), zone);
    if (value instanceof Instant i) return i.atZone(zone).toOffsetDateTime();
    if (value instanceof java.util.Date d) return d.toInstant().atZone(zone).toOffsetDateTime();
    if (value instanceof String s) {
      return TemporalParsing.parseDateTime(s, zone)
          .or(() -> custom == null ? Optional.<OffsetDateTime>empty() : TemporalParsing.parseDateTime(s, custom, zone))
          .orElseThrow(() -> new CoercionException(value, typeName(), "invalid date"));
    }
    if (Values.isIntegral(value)) {
      // Unix timestamp
      return Instant.ofEpochSecond(Values.longValueExact((Number) value)).atZone(zone).toOffsetDateTime();
    }
    throw new CoercionException(value, typeName(), "Value cannot be converted to DateTime");
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    out.put("format", format);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    schema.put("format", format == null ? "date-time" : format);
  }
}
