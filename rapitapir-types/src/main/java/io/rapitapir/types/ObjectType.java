package io.rapitapir.types;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Strict record-like object built field by field.
 * <p>
 * Undeclared keys are not reported by validation and are dropped by coercion; the emitted schema
 * declares {@code additionalProperties: false}.
 */
public final class ObjectType extends BaseType {
  final FieldSet fields;

  ObjectType(Attributes attrs, FieldSet fields) {
    super(attrs);
    this.fields = fields;
  }

  public Map<String, BaseType> fields() { return fields.asMap(); }

  public ObjectType field(String name, BaseType type) {
    return field(name, type, true);
  }

  /** Adds (or replaces) a field; an optional field's type is wrapped in {@link OptionalType}. */
  public ObjectType field(String name, BaseType type, boolean required) {
    Objects.requireNonNull(type, "type");
    BaseType fieldType = required ? type : new OptionalType(type);
    return new ObjectType(attrs, fields.with(name, fieldType));
  }

  public ObjectType requiredField(String name, BaseType type) {
    return field(name, type, true);
  }

  public ObjectType optionalField(String name, BaseType type) {
    return field(name, type, false);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new ObjectType(attrs, fields);
  }

  @Override String typeName() { return "Object"; }
  @Override String jsonType() { return "object"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof Map<?, ?>)) return List.of("Expected hash/object, got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (!(value instanceof Map<?, ?> m)) return List.of();
    return fields.validate(m);
  }

  @Override
  Object coerceValue(Object value) {
    Map<?, ?> source;
    if (value instanceof Map<?, ?> m) source = m;
    else if (value instanceof String s) source = FieldSet.parseObject(s, typeName(), "JSON string did not parse to object");
    else throw new CoercionException(value, typeName(), "Value cannot be converted to object");

    Map<String, Object> out = new LinkedHashMap<>();
    fields.coerceInto(source, out, typeName());
    return out;
  }

  @Override
  void describeConstraints(Map<String, Object> out) {}

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    fields.applyTo(schema);
    schema.put("additionalProperties", false);
  }

  @Override
  public String toString() {
    return fields.isEmpty() ? "Object" : "Object" + fields;
  }

  /** Collects fields for {@link Types#object(java.util.function.Consumer)}. */
  public static final class Builder {
    private ObjectType current;

    Builder(ObjectType start) {
      this.current = start;
    }

    public Builder field(String name, BaseType type) {
      current = current.field(name, type);
      return this;
    }

    public Builder field(String name, BaseType type, boolean required) {
      current = current.field(name, type, required);
      return this;
    }

    public Builder requiredField(String name, BaseType type) {
      current = current.requiredField(name, type);
      return this;
    }

    public Builder optionalField(String name, BaseType type) {
      current = current.optionalField(name, type);
      return this;
    }

    public ObjectType build() {
      return current;
    }
  }
}
