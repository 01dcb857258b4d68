package io.rapitapir.types;

import io.rapitapir.types.format.FormatRegistry;
import io.rapitapir.types.format.FormatValidator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * String with optional length bounds, a search pattern and a named format.
 * <p>
 * Formats resolve through {@link FormatRegistry#global()}; unknown names impose no check.
 */
public sealed class StringType extends BaseType permits EmailType, UuidType {
  final Integer minLength;
  final Integer maxLength;
  final Pattern pattern;
  final String format;

  StringType(Attributes attrs, Integer minLength, Integer maxLength, Pattern pattern, String format) {
    super(attrs);
    if (minLength != null && minLength < 0) throw new IllegalArgumentException("min_length must be >= 0: " + minLength);
    if (maxLength != null && maxLength < 0) throw new IllegalArgumentException("max_length must be >= 0: " + maxLength);
    if (minLength != null && maxLength != null && minLength > maxLength) {
      throw new IllegalArgumentException("min_length " + minLength + " exceeds max_length " + maxLength);
    }
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.pattern = pattern;
    this.format = format;
  }

  public Integer minLength() { return minLength; }
  public Integer maxLength() { return maxLength; }
  public Pattern pattern() { return pattern; }
  public String format() { return format; }

  public StringType withMinLength(Integer minLength) {
    return rebuild(attrs, minLength, maxLength, pattern, format);
  }

  public StringType withMaxLength(Integer maxLength) {
    return rebuild(attrs, minLength, maxLength, pattern, format);
  }

  public StringType withPattern(Pattern pattern) {
    return rebuild(attrs, minLength, maxLength, pattern, format);
  }

  public StringType withPattern(String regex) {
    return withPattern(regex == null ? null : Pattern.compile(regex));
  }

  public StringType withFormat(String format) {
    return rebuild(attrs, minLength, maxLength, pattern, format);
  }

  StringType rebuild(Attributes attrs, Integer minLength, Integer maxLength, Pattern pattern, String format) {
    return new StringType(attrs, minLength, maxLength, pattern, format);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return rebuild(attrs, minLength, maxLength, pattern, format);
  }

  @Override String typeName() { return "String"; }
  @Override String jsonType() { return "string"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof String)) return List.of("Expected string, got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (!(value instanceof String s)) return List.of();
    List<String> errors = new ArrayList<>();
    errors.addAll(lengthErrors(s));
    errors.addAll(patternErrors(s));
    errors.addAll(formatErrors(s));
    return errors;
  }

  final List<String> lengthErrors(String s) {
    int length = s.codePointCount(0, s.length());
    List<String> errors = new ArrayList<>(1);
    if (minLength != null && length < minLength) {
      errors.add("String length " + length + " is below minimum " + minLength);
    }
    if (maxLength != null && length > maxLength) {
      errors.add("String length " + length + " exceeds maximum " + maxLength);
    }
    return errors;
  }

  List<String> patternErrors(String s) {
    if (pattern == null || pattern.matcher(s).find()) return List.of();
    return List.of("String '" + s + "' does not match pattern " + pattern.pattern());
  }

  List<String> formatErrors(String s) {
    if (format == null) return List.of();
    Optional<FormatValidator> fv = FormatRegistry.global().find(format);
    return fv.isPresent() ? fv.get().validate(s) : List.of();
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof String s) return s;
    if (value instanceof BigDecimal bd) return bd.toPlainString();
    if (value instanceof Enum<?> e) return e.name();
    if (value instanceof CharSequence || value instanceof Number
        || value instanceof Boolean || value instanceof Character) {
      return String.valueOf(value);
    }
    if (coercionPolicy().isStrict()) {
      throw new CoercionException(value, typeName(), "Value of type " + Values.typeName(value) + " is not convertible to string");
    }
    return String.valueOf(value);
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    out.put("min_length", minLength);
    out.put("max_length", maxLength);
    out.put("pattern", pattern == null ? null : pattern.pattern());
    out.put("format", format);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    if (minLength != null) schema.put("minLength", minLength);
    if (maxLength != null) schema.put("maxLength", maxLength);
    if (pattern != null) schema.put("pattern", pattern.pattern());
    if (format != null) schema.put("format", format);
  }
}
