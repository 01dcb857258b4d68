package io.rapitapir.types;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DateTimeTypeTest {

  @Test
  void acceptsTemporalValuesAndParseableStrings() {
    DateTimeType t = Types.dateTime();
    assertTrue(t.validate(OffsetDateTime.now()).valid());
    assertTrue(t.validate(Instant.now()).valid());
    assertTrue(t.validate(new java.util.Date()).valid());
    assertTrue(t.validate("2024-01-15T10:30:00Z").valid());
    assertTrue(t.validate("2024-01-15 10:30").valid());
    assertTrue(t.validate("2024-01-15").valid());
    assertEquals(List.of("Expected DateTime, Time, or datetime string, got String"), t.validate("garbage").errors());
    assertEquals(List.of("Expected DateTime, Time, or datetime string, got LocalDate"),
        t.validate(LocalDate.of(2024, 1, 15)).errors());
  }

  @Test
  void namedFormats() {
    assertTrue(Types.dateTime().withFormat("iso8601").validate("2024-01-15T10:30:00.123+02:00").valid());
    assertEquals(List.of("DateTime must be in ISO8601 format"),
        Types.dateTime().withFormat("iso8601").validate("2024-01-15 10:30:00").errors());
    assertEquals(List.of("DateTime must be in RFC3339 format"),
        Types.dateTime().withFormat("rfc3339").validate("2024-01-15T10:30:00").errors());
  }

  @Test
  void customPattern() {
    DateTimeType t = Types.dateTime().withFormat("dd.MM.yyyy HH:mm");
    assertTrue(t.validate("15.01.2024 10:30").valid());
    assertEquals(List.of("DateTime does not match format dd.MM.yyyy HH:mm"), t.validate("2024-01-15T10:30:00Z").errors());
    assertEquals(OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC), t.coerce("15.01.2024 10:30"));
  }

  @Test
  void coercesToOffsetDateTime() {
    DateTimeType t = Types.dateTime();
    OffsetDateTime withOffset = OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.ofHours(2));
    assertSame(withOffset, t.coerce(withOffset));
    assertEquals(withOffset, t.coerce("2024-01-15T10:30:00+02:00"));
    assertEquals(OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC), t.coerce("2024-01-15T10:30:00"));
    assertEquals(OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC), t.coerce(LocalDateTime.of(2024, 1, 15, 10, 30)));
    assertEquals(OffsetDateTime.of(2024, 1, 15, 0, 0, 0, 0, ZoneOffset.UTC), t.coerce(LocalDate.of(2024, 1, 15)));
    assertEquals(OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC), t.coerce(0L));
  }

  @Test
  void unparseableValuesRaise() {
    CoercionException e = assertThrows(CoercionException.class, () -> Types.dateTime().coerce("garbage"));
    assertEquals("DateTime", e.targetType());
    assertThrows(CoercionException.class, () -> Types.dateTime().coerce(true));
  }

  @Test
  void schemaFormat() {
    assertEquals(Map.of("type", "string", "format", "date-time"), Types.dateTime().toJsonSchema());
  }
}
