package io.rapitapir.types;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Floating-point number. Any integral or floating value is valid (an integer is acceptable where a
 * float is expected); coercion produces {@code Double}.
 */
public final class FloatType extends BaseType {
  private static final Pattern FLOAT_TEXT = Pattern.compile(
      "^[+-]?(?:\\d+(?:_\\d+)*(?:\\.\\d+(?:_\\d+)*)?|\\.\\d+(?:_\\d+)*)(?:[eE][+-]?\\d+)?$");

  final NumericBounds bounds;

  FloatType(Attributes attrs, NumericBounds bounds) {
    super(attrs);
    this.bounds = bounds;
  }

  public Number minimum() { return bounds.minimum(); }
  public Number maximum() { return bounds.maximum(); }
  public Number exclusiveMinimum() { return bounds.exclusiveMinimum(); }
  public Number exclusiveMaximum() { return bounds.exclusiveMaximum(); }
  public Number multipleOf() { return bounds.multipleOf(); }

  public FloatType withMinimum(Number minimum) { return new FloatType(attrs, bounds.withMinimum(minimum)); }
  public FloatType withMaximum(Number maximum) { return new FloatType(attrs, bounds.withMaximum(maximum)); }
  public FloatType withExclusiveMinimum(Number v) { return new FloatType(attrs, bounds.withExclusiveMinimum(v)); }
  public FloatType withExclusiveMaximum(Number v) { return new FloatType(attrs, bounds.withExclusiveMaximum(v)); }
  public FloatType withMultipleOf(Number v) { return new FloatType(attrs, bounds.withMultipleOf(v)); }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new FloatType(attrs, bounds);
  }

  @Override String typeName() { return "Float"; }
  @Override String jsonType() { return "number"; }

  @Override
  List<String> validateType(Object value) {
    if (!Values.isNumber(value)) return List.of("Expected number (float or integer), got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (!Values.isNumber(value)) return List.of();
    Number n = (Number) value;
    double d = n.doubleValue();
    if (Double.isNaN(d)) return List.of();
    if (!Values.isFinite(n)) return bounds.validateInfinite(d > 0, Double.toString(d));
    return bounds.validate(Values.toBigDecimal(n), Double.isFinite(d) ? Double.toString(d) : n.toString());
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof Double d) return d;
    if (value instanceof Number n) {
      double d = n.doubleValue();
      if (Double.isInfinite(d) && Values.isFinite(n)) {
        throw new CoercionException(value, typeName(), "Value is out of float range");
      }
      return d;
    }
    if (value instanceof String s) return parse(s);
    if (value instanceof Boolean b) {
      if (coercionPolicy().isStrict()) throw new CoercionException(value, typeName(), "Booleans are not numbers");
      return b ? 1.0 : 0.0;
    }
    throw new CoercionException(value, typeName(), "Value cannot be converted to float");
  }

  private Double parse(String raw) {
    String s = raw.trim();
    if (!FLOAT_TEXT.matcher(s).matches()) {
      throw new CoercionException(raw, typeName(), "invalid value for Float(): \"" + raw + "\"");
    }
    return Double.parseDouble(s.replace("_", ""));
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
