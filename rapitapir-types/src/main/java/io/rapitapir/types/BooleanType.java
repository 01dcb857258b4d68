package io.rapitapir.types;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** True or false. Coercion understands the usual textual spellings (yes/no, on/off, 1/0). */
public final class BooleanType extends BaseType {

  BooleanType(Attributes attrs) {
    super(attrs);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new BooleanType(attrs);
  }

  @Override String typeName() { return "Boolean"; }
  @Override String jsonType() { return "boolean"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof Boolean)) return List.of("Expected boolean (true or false), got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    return List.of();
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) return fromText(s);
    if (Values.isNumber(value) && Values.isFinite((Number) value)) {
      BigDecimal n = Values.toBigDecimal((Number) value);
      if (n.compareTo(BigDecimal.ONE) == 0) return Boolean.TRUE;
      if (n.signum() == 0) return Boolean.FALSE;
    }
    if (coercionPolicy().isStrict()) {
      throw new CoercionException(value, typeName(), "Cannot convert " + Values.inspect(value) + " to boolean");
    }
    // any other value is truthy
    return Boolean.TRUE;
  }

  private Boolean fromText(String raw) {
    switch (raw) {
      case "true": case "TRUE": case "1":
        return Boolean.TRUE;
      case "false": case "FALSE": case "0":
        return Boolean.FALSE;
      default:
        break;
    }
    switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true": case "yes": case "on": case "1":
        return Boolean.TRUE;
      case "false": case "no": case "off": case "0":
        return Boolean.FALSE;
      default:
        throw new CoercionException(raw, typeName(), "Cannot convert '" + raw + "' to boolean");
    }
  }

  @Override
  void describeConstraints(Map<String, Object> out) {}
}
