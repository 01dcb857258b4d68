package io.rapitapir.types;

/**
 * Raised when a value cannot be converted into a type's native representation.
 * <p>
 * Coercion stops at the first failure; callers usually translate this into a client-facing
 * validation error.
 */
public class CoercionException extends RuntimeException {
  private final transient Object value;
  private final String targetType;
  private final String reason;

  public CoercionException(Object value, String targetType, String reason) {
    this(value, targetType, reason, null);
  }

  public CoercionException(Object value, String targetType, String reason, Throwable cause) {
    super(buildMessage(value, targetType, reason), cause);
    this.value = value;
    this.targetType = targetType;
    this.reason = reason;
  }

  public Object value() { return value; }
  public String targetType() { return targetType; }
  public String reason() { return reason; }

  private static String buildMessage(Object value, String targetType, String reason) {
    String base = "Cannot coerce " + Values.inspect(value) + " to " + targetType;
    return reason == null ? base : base + ": " + reason;
  }
}
