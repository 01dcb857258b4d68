package io.rapitapir.types;

import io.rapitapir.types.format.DefaultFormatValidatorProvider;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Textual UUID with version nibble 1-5 and variant nibble 8, 9, a or b (case-insensitive).
 * <p>
 * The pattern is part of the type check: {@code "not-a-uuid"} fails with the type error
 * {@code Invalid UUID format}, not with a constraint error. Coercion keeps the string form.
 */
public final class UuidType extends StringType {
  public static final Pattern UUID_PATTERN = DefaultFormatValidatorProvider.UUID;

  UuidType(Attributes attrs, Integer minLength, Integer maxLength) {
    super(attrs, minLength, maxLength, UUID_PATTERN, null);
  }

  @Override
  StringType rebuild(Attributes attrs, Integer minLength, Integer maxLength, Pattern pattern, String format) {
    if (pattern != UUID_PATTERN || format != null) {
      throw new IllegalArgumentException("UUID pattern is fixed");
    }
    return new UuidType(attrs, minLength, maxLength);
  }

  @Override String typeName() { return "UUID"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof String s)) return List.of("Expected string, got " + Values.typeName(value));
    if (!UUID_PATTERN.matcher(s).matches()) return List.of("Invalid UUID format");
    return List.of();
  }

  @Override
  List<String> patternErrors(String s) {
    return List.of();
  }

  @Override
  Object coerceValue(Object value) {
    if (value instanceof java.util.UUID u) return u.toString();
    return super.coerceValue(value);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    super.applyConstraintsToSchema(schema);
    schema.put("format", "uuid");
  }
}
