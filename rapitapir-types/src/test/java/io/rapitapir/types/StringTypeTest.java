package io.rapitapir.types;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StringTypeTest {

  @Test
  void lengthBoundsAreCheckedIndependently() {
    StringType t = Types.string().withMinLength(3).withMaxLength(5);
    assertTrue(t.validate("abcd").valid());
    assertEquals(List.of("String length 2 is below minimum 3"), t.validate("hi").errors());
    assertEquals(List.of("String length 6 exceeds maximum 5"), t.validate("abcdef").errors());
  }

  @Test
  void lengthCountsCodePoints() {
    assertTrue(Types.string().withMaxLength(1).validate("😀").valid());
  }

  @Test
  void patternUsesSearchSemantics() {
    assertTrue(Types.string().withPattern("[0-9]+").validate("abc123").valid());
    assertEquals(List.of("String 'abc1' does not match pattern ^[a-z]+$"),
        Types.string().withPattern("^[a-z]+$").validate("abc1").errors());
  }

  @Test
  void wrongShapeYieldsOnlyTheTypeError() {
    ValidationResult r = Types.string().withMinLength(3).withPattern("x").validate(42);
    assertFalse(r.valid());
    assertEquals(List.of("Expected string, got Integer"), r.errors());
    assertEquals(1, r.valueErrors().size());
  }

  @Test
  void nilHandlingFollowsOptionality() {
    assertEquals(List.of("Value is required but got nil"), Types.string().validate(null).errors());
    assertTrue(Types.string().withOptional(true).validate(null).valid());
  }

  @Test
  void formatsResolveThroughRegistry() {
    StringType email = Types.string().withFormat("email");
    assertTrue(email.validate("a@b.io").valid());
    assertEquals(List.of("Invalid email format"), email.validate("nope").errors());

    assertEquals(List.of("Invalid IPv4 format"), Types.string().withFormat("ipv4").validate("256.1.1.1").errors());
    assertTrue(Types.string().withFormat("ipv6").validate("::1").valid());
    assertTrue(Types.string().withFormat("url").validate("https://example.com/x").valid());
    assertTrue(Types.string().withFormat("date-time").validate("2024-01-15T10:00:00Z").valid());
  }

  @Test
  void unknownFormatImposesNoCheck() {
    assertTrue(Types.string().withFormat("no-such-format").validate("anything").valid());
  }

  @Test
  void coercesScalarsToText() {
    StringType t = Types.string();
    assertEquals("hello", t.coerce("hello"));
    assertEquals("42", t.coerce(42));
    assertEquals("1.50", t.coerce(new BigDecimal("1.50")));
    assertEquals("true", t.coerce(true));
    assertEquals("x", t.coerce('x'));
  }

  @Test
  void strictPolicyRejectsArbitraryObjects() {
    Object any = List.of(1);
    assertEquals("[1]", Types.string().coerce(any));

    BaseType strict = Types.string().withCoercion(CoercionPolicy.STRICT);
    CoercionException e = assertThrows(CoercionException.class, () -> strict.coerce(any));
    assertEquals("String", e.targetType());
  }

  @Test
  void requiredNilCannotBeCoerced() {
    CoercionException e = assertThrows(CoercionException.class, () -> Types.string().coerce(null));
    assertEquals("Cannot coerce null to String: Required value cannot be nil", e.getMessage());
    assertNull(Types.string().withOptional(true).coerce(null));
  }

  @Test
  void schemaAndConstraints() {
    StringType t = Types.string().withMinLength(1).withMaxLength(5).withPattern("^[a-z]+$");
    assertEquals(Map.of("type", "string", "minLength", 1, "maxLength", 5, "pattern", "^[a-z]+$"), t.toJsonSchema());
    assertEquals(List.of("min_length", "max_length", "pattern"), List.copyOf(t.constraints().keySet()));
    assertEquals("String(min_length: 1, max_length: 5, pattern: ^[a-z]+$)", t.toString());
  }

  @Test
  void invalidBoundsFailAtConstruction() {
    assertThrows(IllegalArgumentException.class, () -> Types.string().withMinLength(-1));
    assertThrows(IllegalArgumentException.class, () -> Types.string().withMaxLength(2).withMinLength(3));
  }

  @Test
  void withersLeaveReceiverUntouched() {
    StringType base = Types.string();
    BaseType described = base.withMinLength(2).withDescription("Name");
    assertTrue(base.constraints().isEmpty());
    assertTrue(base.metadata().isEmpty());
    assertEquals("Name", described.metadata().get("description"));
    assertEquals(2, described.constraints().get("min_length"));
  }
}
