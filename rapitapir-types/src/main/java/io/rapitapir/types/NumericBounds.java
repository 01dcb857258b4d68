package io.rapitapir.types;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Range and step constraints of {@link IntegerType} and {@link FloatType}.
 * <p>
 * Comparisons are exact ({@code BigDecimal}); every bound is checked independently.
 */
record NumericBounds(Number minimum, Number maximum, Number exclusiveMinimum, Number exclusiveMaximum,
                     Number multipleOf) {
  static final NumericBounds NONE = new NumericBounds(null, null, null, null, null);

  NumericBounds {
    requireFinite("minimum", minimum);
    requireFinite("maximum", maximum);
    requireFinite("exclusive_minimum", exclusiveMinimum);
    requireFinite("exclusive_maximum", exclusiveMaximum);
    requireFinite("multiple_of", multipleOf);
    if (multipleOf != null && Values.toBigDecimal(multipleOf).signum() <= 0) {
      throw new IllegalArgumentException("multiple_of must be positive: " + multipleOf);
    }
  }

  NumericBounds withMinimum(Number v) { return new NumericBounds(v, maximum, exclusiveMinimum, exclusiveMaximum, multipleOf); }
  NumericBounds withMaximum(Number v) { return new NumericBounds(minimum, v, exclusiveMinimum, exclusiveMaximum, multipleOf); }
  NumericBounds withExclusiveMinimum(Number v) { return new NumericBounds(minimum, maximum, v, exclusiveMaximum, multipleOf); }
  NumericBounds withExclusiveMaximum(Number v) { return new NumericBounds(minimum, maximum, exclusiveMinimum, v, multipleOf); }
  NumericBounds withMultipleOf(Number v) { return new NumericBounds(minimum, maximum, exclusiveMinimum, exclusiveMaximum, v); }

  /**
   * @param value   the value under test
   * @param printed how the value appears in messages
   */
  List<String> validate(BigDecimal value, String printed) {
    List<String> errors = new ArrayList<>();
    if (minimum != null && value.compareTo(dec(minimum)) < 0) {
      errors.add("Value " + printed + " is below minimum " + minimum);
    }
    if (maximum != null && value.compareTo(dec(maximum)) > 0) {
      errors.add("Value " + printed + " exceeds maximum " + maximum);
    }
    if (exclusiveMinimum != null && value.compareTo(dec(exclusiveMinimum)) <= 0) {
      errors.add("Value " + printed + " must be greater than " + exclusiveMinimum);
    }
    if (exclusiveMaximum != null && value.compareTo(dec(exclusiveMaximum)) >= 0) {
      errors.add("Value " + printed + " must be less than " + exclusiveMaximum);
    }
    if (multipleOf != null && value.remainder(dec(multipleOf)).signum() != 0) {
      errors.add("Value " + printed + " is not a multiple of " + multipleOf);
    }
    return errors;
  }

  /** Infinite values fail the bounds on their side and never satisfy {@code multiple_of}. */
  List<String> validateInfinite(boolean positive, String printed) {
    List<String> errors = new ArrayList<>();
    if (!positive && minimum != null) errors.add("Value " + printed + " is below minimum " + minimum);
    if (positive && maximum != null) errors.add("Value " + printed + " exceeds maximum " + maximum);
    if (!positive && exclusiveMinimum != null) errors.add("Value " + printed + " must be greater than " + exclusiveMinimum);
    if (positive && exclusiveMaximum != null) errors.add("Value " + printed + " must be less than " + exclusiveMaximum);
    if (multipleOf != null) errors.add("Value " + printed + " is not a multiple of " + multipleOf);
    return errors;
  }

  void describe(Map<String, Object> out) {
    out.put("minimum", minimum);
    out.put("maximum", maximum);
    out.put("exclusive_minimum", exclusiveMinimum);
    out.put("exclusive_maximum", exclusiveMaximum);
    out.put("multiple_of", multipleOf);
  }

  void applyTo(Map<String, Object> schema) {
    if (minimum != null) schema.put("minimum", minimum);
    if (maximum != null) schema.put("maximum", maximum);
    if (exclusiveMinimum != null) schema.put("exclusiveMinimum", exclusiveMinimum);
    if (exclusiveMaximum != null) schema.put("exclusiveMaximum", exclusiveMaximum);
    if (multipleOf != null) schema.put("multipleOf", multipleOf);
  }

  private static BigDecimal dec(Number n) {
    return Values.toBigDecimal(n);
  }

  private static void requireFinite(String name, Number n) {
    if (n != null && !Values.isFinite(n)) throw new IllegalArgumentException(name + " must be finite: " + n);
  }
}
