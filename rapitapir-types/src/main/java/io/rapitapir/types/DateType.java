package io.rapitapir.types;

import io.rapitapir.types.config.TypesConfig;
import io.rapitapir.types.util.TemporalParsing;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Calendar date; coerces to {@link LocalDate}.
 * <p>
 * The {@code format} constraint ({@value #ISO8601} or a {@link DateTimeFormatter} pattern) only
 * restricts how date strings must be written during validation; coercion accepts any parseable
 * form.
 */
public final class DateType extends BaseType {
  public static final String ISO8601 = "iso8601";

  private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  final String format;
  private final DateTimeFormatter custom;

  DateType(Attributes attrs, String format) {
    super(attrs);
    this.format = format;
    this.custom = format == null || ISO8601.equalsIgnoreCase(format) ? null : TemporalParsing.strictPattern(format);
  }

  public String format() { return format; }

  public DateType withFormat(String format) {
    return new DateType(attrs, format);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new DateType(attrs, format);
  }

  @Override String typeName() { return "Date"; }
  @Override String jsonType() { return "string"; }

  @Override
  List<String> validateType(Object value) {
    if (value instanceof LocalDate || value instanceof LocalDateTime
        || value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
      return List.of();
    }
    if (value instanceof String s && (TemporalParsing.isDate(s) || custom != null && TemporalParsing.matches(s, custom))) {
      return List.of();
    }
    return List.of("Expected Date or date string, got " + Values.typeName(value));
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (format == null || !(value instanceof String s)) return List.of();
    if (custom == null) {
      return ISO_DATE.matcher(s).matches() ? List.of() : List.of("Date must be in ISO8601 format (YYYY-MM-DD)");
    }
    return TemporalParsing.matches(s, custom) ? List.of() : List.of("Date does not match format " + format);
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof LocalDate d) return d;
    if (value instanceof LocalDateTime dt) return dt.toLocalDate();
    if (value instanceof OffsetDateTime dt) return dt.toLocalDate();
    if (value instanceof ZonedDateTime dt) return dt.toLocalDate();
    if (value instanceof java.sql.Date d) return d.toLocalDate();
    if (value instanceof Instant i) return LocalDate.ofInstant(i, TypesConfig.global().zone());
    if (value instanceof java.util.Date d) return LocalDate.ofInstant(d.toInstant(), TypesConfig.global().zone());
    if (value instanceof String s) {
      return TemporalParsing.parseDate(s)
          .or(() -> custom == null ? Optional.<LocalDate>empty() : TemporalParsing.parseDate(s, custom))
          .orElseThrow(() -> new CoercionException(value, typeName(), "invalid date"));
    }
    if (Values.isIntegral(value)) {
      // Unix timestamp
      Instant at = Instant.ofEpochSecond(Values.longValueExact((Number) value));
      return LocalDate.ofInstant(at, TypesConfig.global().zone());
    }
    throw new CoercionException(value, typeName(), "Value cannot be converted to Date");
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    out.put("format", format);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    schema.put("format", format == null ? "date" : format);
  }
}
