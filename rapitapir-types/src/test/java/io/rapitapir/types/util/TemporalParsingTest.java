package io.rapitapir.types.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class TemporalParsingTest {

  @Test
  void parsesCommonDateForms() {
    LocalDate d = LocalDate.of(2024, 1, 15);
    assertEquals(Optional.of(d), TemporalParsing.parseDate("2024-01-15"));
    assertEquals(Optional.of(d), TemporalParsing.parseDate("20240115"));
    assertEquals(Optional.of(d), TemporalParsing.parseDate("2024/1/15"));
    assertEquals(Optional.of(d), TemporalParsing.parseDate("jan 15, 2024"));
    assertEquals(Optional.of(d), TemporalParsing.parseDate("Monday, January 15, 2024"));
    assertEquals(Optional.of(d), TemporalParsing.parseDate("Mon, 15 Jan 2024 10:00:00 GMT"));
    assertTrue(TemporalParsing.parseDate("2023-02-29").isEmpty());
    assertTrue(TemporalParsing.parseDate("  ").isEmpty());
  }

  @Test
  void localDateTimesTakeTheGivenZone() {
    ZoneId berlin = ZoneId.of("Europe/Berlin");
    assertEquals(OffsetDateTime.of(2024, 1, 15, 10, 0, 0, 0, ZoneOffset.ofHours(1)),
        TemporalParsing.parseDateTime("2024-01-15T10:00:00", berlin).orElseThrow());
    assertEquals(OffsetDateTime.of(2024, 7, 1, 0, 0, 0, 0, ZoneOffset.ofHours(2)),
        TemporalParsing.parseDateTime("2024-07-01", berlin).orElseThrow());
  }

  @Test
  void zonedInputKeepsItsOffset() {
    assertEquals(OffsetDateTime.of(2024, 1, 15, 10, 0, 0, 0, ZoneOffset.ofHours(1)),
        TemporalParsing.parseDateTime("2024-01-15T10:00:00+01:00[Europe/Paris]", ZoneOffset.UTC).orElseThrow());
  }

  @Test
  void strictPatterns() {
    DateTimeFormatter f = TemporalParsing.strictPattern("dd/MM/yyyy");
    assertTrue(TemporalParsing.matches("29/02/2024", f));
    assertFalse(TemporalParsing.matches("29/02/2023", f));
    assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), TemporalParsing.parseDate("29/02/2024", f));
    assertThrows(IllegalArgumentException.class, () -> TemporalParsing.strictPattern("#"));
  }
}
