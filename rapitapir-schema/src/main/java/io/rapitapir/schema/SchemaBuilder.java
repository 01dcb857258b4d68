package io.rapitapir.schema;

import io.rapitapir.types.ObjectType;
import io.rapitapir.types.Types;

/** Accumulates fields for {@link Schema#define(java.util.function.Consumer)}. */
public final class SchemaBuilder {
  private ObjectType object = Types.object();

  SchemaBuilder() {}

  public SchemaBuilder field(String name, Object definition) {
    return field(name, definition, true);
  }

  public SchemaBuilder field(String name, Object definition, boolean required) {
    object = object.field(name, Schema.fromDefinition(definition), required);
    return this;
  }

  public SchemaBuilder requiredField(String name, Object definition) {
    return field(name, definition, true);
  }

  public SchemaBuilder optionalField(String name, Object definition) {
    return field(name, definition, false);
  }

  ObjectType build() {
    return object;
  }
}
