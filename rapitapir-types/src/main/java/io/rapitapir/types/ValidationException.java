package io.rapitapir.types;

import java.util.List;

/**
 * Aggregated validation failure of one value against one type.
 * <p>
 * Instances inside a {@link ValidationResult} are plain data carriers and capture no stack trace.
 */
public class ValidationException extends RuntimeException {
  private final transient Object value;
  private final transient BaseType type;
  private final List<String> errors;

  public ValidationException(Object value, BaseType type, List<String> errors) {
    this(buildMessage(value, type, errors), value, type, errors, true);
  }

  protected ValidationException(String message, Object value, BaseType type, List<String> errors,
                                boolean writableStackTrace) {
    super(message, null, false, writableStackTrace);
    this.value = value;
    this.type = type;
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  static ValidationException detached(Object value, BaseType type, List<String> errors) {
    return new ValidationException(buildMessage(value, type, errors), value, type, errors, false);
  }

  public Object value() { return value; }
  public BaseType type() { return type; }
  public List<String> errors() { return errors; }

  private static String buildMessage(Object value, BaseType type, List<String> errors) {
    String base = "Validation failed for value " + Values.inspect(value) + " against type " + type;
    if (errors == null || errors.isEmpty()) return base;
    StringBuilder sb = new StringBuilder(base).append(':');
    for (String e : errors) sb.append("\n  - ").append(e);
    return sb.toString();
  }
}
