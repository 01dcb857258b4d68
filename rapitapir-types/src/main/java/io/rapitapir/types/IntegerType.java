package io.rapitapir.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole number. Native values are {@code Byte}, {@code Short}, {@code Integer}, {@code Long} and
 * {@code BigInteger}; they coerce to themselves. Parsed and converted values are {@code Long}, or
 * {@code BigInteger} beyond the long range. Text accepts {@code 0x}, {@code 0b} and {@code 0o}
 * prefixes; a bare leading zero also marks octal ({@code "017"} is 15, {@code "08"} is rejected).
 */
public final class IntegerType extends BaseType {
  private static final Pattern INTEGER_TEXT = Pattern.compile(
      "^([+-])?(?:0[xX]([0-9a-fA-F]+(?:_[0-9a-fA-F]+)*)|0[bB]([01]+(?:_[01]+)*)|0[oO_]?([0-7]+(?:_[0-7]+)*)|(0|[1-9]\\d*(?:_\\d+)*))$");

  final NumericBounds bounds;

  IntegerType(Attributes attrs, NumericBounds bounds) {
    super(attrs);
    this.bounds = bounds;
  }

  public Number minimum() { return bounds.minimum(); }
  public Number maximum() { return bounds.maximum(); }
  public Number exclusiveMinimum() { return bounds.exclusiveMinimum(); }
  public Number exclusiveMaximum() { return bounds.exclusiveMaximum(); }
  public Number multipleOf() { return bounds.multipleOf(); }

  public IntegerType withMinimum(Number minimum) { return new IntegerType(attrs, bounds.withMinimum(minimum)); }
  public IntegerType withMaximum(Number maximum) { return new IntegerType(attrs, bounds.withMaximum(maximum)); }
  public IntegerType withExclusiveMinimum(Number v) { return new IntegerType(attrs, bounds.withExclusiveMinimum(v)); }
  public IntegerType withExclusiveMaximum(Number v) { return new IntegerType(attrs, bounds.withExclusiveMaximum(v)); }
  public IntegerType withMultipleOf(Number v) { return new IntegerType(attrs, bounds.withMultipleOf(v)); }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new IntegerType(attrs, bounds);
  }

  @Override String typeName() { return "Integer"; }
  @Override String jsonType() { return "integer"; }

  @Override
  List<String> validateType(Object value) {
    if (!Values.isIntegral(value)) return List.of("Expected integer, got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (!Values.isIntegral(value)) return List.of();
    Number n = (Number) value;
    return bounds.validate(Values.toBigDecimal(n), String.valueOf(n));
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof AtomicInteger || value instanceof AtomicLong) return ((Number) value).longValue();
    if (Values.isIntegral(value)) return value;
    if (value instanceof Number n) return fromFractional(n);
    if (value instanceof String s) return parse(s);
    if (value instanceof Boolean b) {
      if (coercionPolicy().isStrict()) throw new CoercionException(value, typeName(), "Booleans are not integers");
      return b ? 1L : 0L;
    }
    throw new CoercionException(value, typeName(), "Value cannot be converted to integer");
  }

  private Number fromFractional(Number n) {
    if (!Values.isFinite(n)) throw new CoercionException(n, typeName(), "Value is not a finite number");
    BigDecimal bd = Values.toBigDecimal(n);
    if (coercionPolicy().isStrict() && bd.stripTrailingZeros().scale() > 0) {
      throw new CoercionException(n, typeName(), "Value has a fractional part");
    }
    // toBigInteger truncates toward zero
    return Values.narrow(bd.toBigInteger());
  }

  private Number parse(String raw) {
    Matcher m = INTEGER_TEXT.matcher(raw.trim());
    if (!m.matches()) throw new CoercionException(raw, typeName(), "invalid value for Integer(): \"" + raw + "\"");
    BigInteger magnitude;
    if (m.group(2) != null) magnitude = new BigInteger(m.group(2).replace("_", ""), 16);
    else if (m.group(3) != null) magnitude = new BigInteger(m.group(3).replace("_", ""), 2);
    else if (m.group(4) != null) magnitude = new BigInteger(m.group(4).replace("_", ""), 8);
    else magnitude = new BigInteger(m.group(5).replace("_", ""));
    return Values.narrow("-".equals(m.group(1)) ? magnitude.negate() : magnitude);
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    bounds.describe(out);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    bounds.applyTo(schema);
  }
}
