package io.rapitapir.schema;

import io.rapitapir.types.BaseType;
import io.rapitapir.types.ObjectType;
import io.rapitapir.types.Types;
import io.rapitapir.types.ValidationResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Facade over the type system: validation, coercion and types from compact definitions.\n
 *
 * Definitions accepted by {@link #fromDefinition(Object)}:\n
 * - a primitive name: string, integer, float, boolean, date, datetime, uuid, email\n
 * - {@code Map.of("type", "integer")}\n
 * - a map of field name to definition (strict object, every field required)\n
 * - a one-element list (array of the element's definition)\n
 * - an existing {@link BaseType}\n
 */
public final class Schema {
  private Schema() {}

  public static ValidationResult validate(Object value, BaseType type) {
    return Objects.requireNonNull(type, "type").validate(value);
  }

  /** Returns {@code value} unchanged when valid. */
  public static <T> T validateOrThrow(T value, BaseType type) {
    ValidationResult r = validate(value, type);
    if (r.valid()) return value;
    throw new SchemaValidationException(value, type, r.errors());
  }

  public static Object coerce(Object value, BaseType type) {
    return Objects.requireNonNull(type, "type").coerce(value);
  }

  public static BaseType fromDefinition(Object definition) {
    if (definition instanceof BaseType t) return t;
    if (definition instanceof String name) return primitive(name);
    if (definition instanceof Map<?, ?> m) {
      if (m.size() == 1 && m.get("type") instanceof String name) return primitive(name);
      return objectFrom(m);
    }
    if (definition instanceof List<?> l) {
      if (l.size() != 1) throw new IllegalArgumentException("Array definition must have exactly one element type");
      return Types.array(fromDefinition(l.get(0)));
    }
    String kind = definition == null ? "null" : definition.getClass().getSimpleName();
    throw new IllegalArgumentException("Unknown definition type: " + kind);
  }

  /** Builds a strict object; field definitions go through {@link #fromDefinition(Object)}. */
  public static ObjectType define(Consumer<SchemaBuilder> fields) {
    SchemaBuilder b = new SchemaBuilder();
    fields.accept(b);
    return b.build();
  }

  static BaseType primitive(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "string": return Types.string();
      case "integer": return Types.integer();
      case "float": return Types.floatType();
      case "boolean": return Types.bool();
      case "date": return Types.date();
      case "datetime": return Types.dateTime();
      case "uuid": return Types.uuid();
      case "email": return Types.email();
      default: throw new IllegalArgumentException("Unknown primitive type: " + name);
    }
  }

  private static ObjectType objectFrom(Map<?, ?> definition) {
    ObjectType out = Types.object();
    for (Map.Entry<?, ?> e : definition.entrySet()) {
      out = out.field(String.valueOf(e.getKey()), fromDefinition(e.getValue()));
    }
    return out;
  }
}
