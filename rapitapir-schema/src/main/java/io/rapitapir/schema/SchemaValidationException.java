package io.rapitapir.schema;

import io.rapitapir.types.BaseType;
import io.rapitapir.types.ValidationException;

import java.util.List;

/** Thrown by {@link Schema#validateOrThrow(Object, BaseType)}. */
public class SchemaValidationException extends ValidationException {

  public SchemaValidationException(Object value, BaseType type, List<String> errors) {
    super(buildMessage(errors), value, type, errors, true);
  }

  private static String buildMessage(List<String> errors) {
    StringBuilder sb = new StringBuilder("Schema validation failed:");
    if (errors != null) for (String e : errors) sb.append("\n  - ").append(e);
    return sb.toString();
  }
}
