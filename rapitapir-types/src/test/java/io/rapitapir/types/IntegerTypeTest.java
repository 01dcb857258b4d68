package io.rapitapir.types;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class IntegerTypeTest {

  @Test
  void acceptsIntegralValuesOnly() {
    IntegerType t = Types.integer();
    assertTrue(t.validate(1).valid());
    assertTrue(t.validate(1L).valid());
    assertTrue(t.validate(new BigInteger("123456789012345678901234567890")).valid());
    assertEquals(List.of("Expected integer, got Double"), t.validate(3.5).errors());
    assertEquals(List.of("Expected integer, got String"), t.validate("3").errors());
  }

  @Test
  void boundsProduceIndependentErrors() {
    assertEquals(List.of("Value 5 is below minimum 10"), Types.integer().withMinimum(10).validate(5).errors());
    assertEquals(List.of("Value 11 exceeds maximum 10"), Types.integer().withMaximum(10).validate(11).errors());
    assertEquals(List.of("Value 0 must be greater than 0"), Types.integer().withExclusiveMinimum(0).validate(0).errors());
    assertEquals(List.of("Value 10 must be less than 10"), Types.integer().withExclusiveMaximum(10).validate(10).errors());
    assertEquals(List.of("Value 7 is not a multiple of 3"), Types.integer().withMultipleOf(3).validate(7).errors());

    IntegerType both = Types.integer().withMinimum(10).withMultipleOf(3);
    assertEquals(List.of("Value 7 is below minimum 10", "Value 7 is not a multiple of 3"), both.validate(7).errors());
  }

  @Test
  void multipleOfMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> Types.integer().withMultipleOf(0));
    assertThrows(IllegalArgumentException.class, () -> Types.integer().withMinimum(Double.NaN));
  }

  @Test
  void parsesIntegerText() {
    IntegerType t = Types.integer();
    assertEquals(42L, t.coerce("42"));
    assertEquals(42L, t.coerce(" +42 "));
    assertEquals(-31L, t.coerce("-0x1F"));
    assertEquals(5L, t.coerce("0b101"));
    assertEquals(15L, t.coerce("0o17"));
    assertEquals(15L, t.coerce("017"));
    assertEquals(15L, t.coerce("0_17"));
    assertEquals(0L, t.coerce("0"));
    assertEquals(0L, t.coerce("-00"));
    assertEquals(1000L, t.coerce("1_000"));
    assertEquals(new BigInteger("99999999999999999999"), t.coerce("99999999999999999999"));
  }

  @Test
  void rejectsMalformedText() {
    IntegerType t = Types.integer();
    CoercionException e = assertThrows(CoercionException.class, () -> t.coerce("abc"));
    assertEquals("Integer", e.targetType());
    assertEquals("abc", e.value());
    assertThrows(CoercionException.class, () -> t.coerce("12abc"));
    assertThrows(CoercionException.class, () -> t.coerce("1__0"));
    assertThrows(CoercionException.class, () -> t.coerce("08"));
    assertThrows(CoercionException.class, () -> t.coerce("0o8"));
    assertThrows(CoercionException.class, () -> t.coerce("1.5"));
    assertThrows(CoercionException.class, () -> t.coerce(""));
  }

  @Test
  void integralValuesPassThroughUnchanged() {
    Object seven = 7;
    assertSame(seven, Types.integer().coerce(seven));
  }

  @Test
  void fractionalNumbersTruncateUnlessStrict() {
    assertEquals(3L, Types.integer().coerce(3.9));
    assertEquals(-3L, Types.integer().coerce(-3.9));
    assertThrows(CoercionException.class, () -> Types.integer().coerce(Double.NaN));

    BaseType strict = Types.integer().withCoercion(CoercionPolicy.STRICT);
    assertEquals(3L, strict.coerce(3.0));
    assertThrows(CoercionException.class, () -> strict.coerce(3.5));
  }

  @Test
  void booleansFollowPolicy() {
    assertEquals(1L, Types.integer().coerce(true));
    assertEquals(0L, Types.integer().coerce(false));
    assertThrows(CoercionException.class, () -> Types.integer().withCoercion(CoercionPolicy.STRICT).coerce(true));
  }

  @Test
  void otherValuesCannotBeConverted() {
    CoercionException e = assertThrows(CoercionException.class, () -> Types.integer().coerce(List.of(1)));
    assertEquals("Value cannot be converted to integer", e.reason());
  }

  @Test
  void schemaKeywords() {
    IntegerType t = Types.integer().withMinimum(1).withMaximum(10).withMultipleOf(2);
    assertEquals(Map.of("type", "integer", "minimum", 1, "maximum", 10, "multipleOf", 2), t.toJsonSchema());
    assertEquals("Integer(minimum: 1, maximum: 10, multiple_of: 2)", t.toString());
  }
}
