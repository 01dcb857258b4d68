package io.rapitapir.types;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map with declared field types. Undeclared keys are allowed by default and copied through
 * coercion unchanged; with additional properties disabled they are reported by validation.
 */
public final class HashType extends BaseType {
  final FieldSet fields;
  final boolean additionalProperties;

  HashType(Attributes attrs, FieldSet fields, boolean additionalProperties) {
    super(attrs);
    this.fields = fields;
    this.additionalProperties = additionalProperties;
  }

  public Map<String, BaseType> fieldTypes() { return fields.asMap(); }
  public boolean additionalProperties() { return additionalProperties; }

  public HashType withField(String name, BaseType type) {
    return new HashType(attrs, fields.with(name, type), additionalProperties);
  }

  public HashType withAdditionalProperties(boolean additionalProperties) {
    return new HashType(attrs, fields, additionalProperties);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new HashType(attrs, fields, additionalProperties);
  }

  @Override String typeName() { return "Hash"; }
  @Override String jsonType() { return "object"; }

  @Override
  List<String> validateType(Object value) {
    if (!(value instanceof Map<?, ?>)) return List.of("Expected hash/object, got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    if (!(value instanceof Map<?, ?> m)) return List.of();
    List<String> errors = new ArrayList<>(fields.validate(m));
    if (!additionalProperties) {
      List<String> unexpected = fields.unexpectedKeys(m);
      if (!unexpected.isEmpty()) errors.add("Unexpected fields: " + String.join(", ", unexpected));
    }
    return errors;
  }

  @Override
  Object coerceValue(Object value) {
    Map<?, ?> source;
    if (value instanceof Map<?, ?> m) source = m;
    else if (value instanceof String s) source = FieldSet.parseObject(s, typeName(), "JSON string did not parse to hash");
    else throw new CoercionException(value, typeName(), "Value cannot be converted to hash");

    Map<String, Object> out = new LinkedHashMap<>();
    fields.coerceInto(source, out, typeName());
    if (additionalProperties) fields.copyUndeclared(source, out);
    return out;
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    out.put("additional_properties", additionalProperties);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    fields.applyTo(schema);
    schema.put("additionalProperties", additionalProperties);
  }

  @Override
  public String toString() {
    return fields.isEmpty() ? "Hash" : "Hash" + fields;
  }
}
