package io.rapitapir.types.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.rapitapir.types.BaseType;

import java.util.Objects;

/** Renders {@link BaseType#toJsonSchema()} as JSON text for embedding into larger documents. */
public final class JsonSchemaWriter {
  private JsonSchemaWriter() {}

  public static String write(BaseType type) {
    return render(type, false);
  }

  public static String writePretty(BaseType type) {
    return render(type, true);
  }

  private static String render(BaseType type, boolean pretty) {
    Objects.requireNonNull(type, "type");
    try {
      return pretty
          ? JsonValues.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(type.toJsonSchema())
          : JsonValues.mapper().writeValueAsString(type.toJsonSchema());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-encode schema of " + type, e);
    }
  }
}
