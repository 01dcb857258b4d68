package io.rapitapir.types;

import io.rapitapir.types.format.DefaultFormatValidatorProvider;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Email address. The fixed pattern is checked as part of the type check, so a malformed address is
 * a type error reported once ({@code Invalid email format}).
 */
public final class EmailType extends StringType {
  public static final Pattern EMAIL_PATTERN = DefaultFormatValidatorProvider.EMAIL;

  EmailType(Attributes attrs, Integer minLength, Integer maxLength) {
    super(attrs, minLength, maxLength, EMAIL_PATTERN, "email");
  }

  @Override
  StringType rebuild(Attributes attrs, Integer minLength, Integer maxLength, Pattern pattern, String format) {
    if (pattern != EMAIL_PATTERN || !Objects.equals(format, "email")) {
      throw new IllegalArgumentException("Email pattern and format are fixed");
    }
    return new EmailType(attrs, minLength, maxLength);
  }

  @Override String typeName() { return "Email"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof String s)) return List.of("Expected string, got " + Values.typeName(value));
    if (!EMAIL_PATTERN.matcher(s).matches()) return List.of("Invalid email format");
    return List.of();
  }

  @Override
  List<String> patternErrors(String s) {
    return List.of();
  }

  @Override
  List<String> formatErrors(String s) {
    return List.of();
  }
}
