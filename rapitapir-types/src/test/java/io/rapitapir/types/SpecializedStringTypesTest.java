package io.rapitapir.types;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SpecializedStringTypesTest {

  @Test
  void uuidVersionAndVariantBoundaries() {
    UuidType t = Types.uuid();
    assertTrue(t.validate("550e8400-e29b-41d4-a716-446655440000").valid());
    assertTrue(t.validate("550E8400-E29B-41D4-A716-446655440000").valid());
    assertEquals(List.of("Invalid UUID format"), t.validate("not-a-uuid").errors());
    // version nibble 0
    assertFalse(t.validate("550e8400-e29b-01d4-a716-446655440000").valid());
    // variant nibble c
    assertFalse(t.validate("550e8400-e29b-41d4-c716-446655440000").valid());
    assertEquals(List.of("Expected string, got Integer"), t.validate(7).errors());
  }

  @Test
  void uuidCoercesJavaUuid() {
    UUID id = UUID.fromString("550e8400-e29b-41d4-a716-446655440000");
    assertEquals("550e8400-e29b-41d4-a716-446655440000", Types.uuid().coerce(id));
  }

  @Test
  void uuidSchema() {
    Map<String, Object> schema = Types.uuid().toJsonSchema();
    assertEquals("string", schema.get("type"));
    assertEquals("uuid", schema.get("format"));
    assertEquals(UuidType.UUID_PATTERN.pattern(), schema.get("pattern"));
  }

  @Test
  void emailErrorIsReportedOnce() {
    EmailType t = Types.email();
    assertTrue(t.validate("user.name+tag@example.co.uk").valid());
    assertEquals(List.of("Invalid email format"), t.validate("bad").errors());
    assertEquals(List.of("Invalid email format"), t.validate("a@b").errors());
  }

  @Test
  void emailKeepsLengthBounds() {
    StringType t = Types.email().withMaxLength(8);
    assertTrue(t instanceof EmailType);
    assertEquals(List.of("String length 12 exceeds maximum 8"), t.validate("abc@test.com").errors());
  }

  @Test
  void fixedPatternCannotBeReplaced() {
    assertThrows(IllegalArgumentException.class, () -> Types.email().withPattern(".*"));
    assertThrows(IllegalArgumentException.class, () -> Types.uuid().withFormat("uri"));
  }

  @Test
  void emailSchema() {
    assertEquals("email", Types.email().toJsonSchema().get("format"));
    assertEquals("Email", Types.email().typeName());
  }
}
