package io.rapitapir.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.rapitapir.types.json.JsonValues;

import java.util.*;

/**
 * Named field types of {@link HashType} and {@link ObjectType}, in declaration order.
 * <p>
 * Input maps are read by {@code String} key; a map keyed by other objects (enums, other char
 * sequences) matches a field when {@code String.valueOf(key)} equals the field name.
 */
final class FieldSet {
  static final FieldSet EMPTY = new FieldSet(Map.of());

  private final Map<String, BaseType> fields;

  FieldSet(Map<String, ? extends BaseType> fields) {
    Map<String, BaseType> copy = new LinkedHashMap<>();
    fields.forEach((name, type) -> {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("Field name is blank");
      copy.put(name, Objects.requireNonNull(type, () -> "type of field '" + name + "'"));
    });
    this.fields = Collections.unmodifiableMap(copy);
  }

  Map<String, BaseType> asMap() {
    return fields;
  }

  boolean isEmpty() {
    return fields.isEmpty();
  }

  FieldSet with(String name, BaseType type) {
    Map<String, BaseType> next = new LinkedHashMap<>(fields);
    next.put(name, type);
    return new FieldSet(next);
  }

  List<String> validate(Map<?, ?> value) {
    List<String> errors = new ArrayList<>();
    fields.forEach((name, type) -> {
      ValidationResult r = type.validate(lookup(value, name));
      for (String e : r.errors()) errors.add("Field '" + name + "': " + e);
    });
    return errors;
  }

  /** Keys of {@code value} that name no declared field, rendered with {@code String.valueOf}. */
  List<String> unexpectedKeys(Map<?, ?> value) {
    List<String> out = new ArrayList<>();
    for (Object key : value.keySet()) {
      String k = String.valueOf(key);
      if (!fields.containsKey(k)) out.add(k);
    }
    return out;
  }

  /**
   * Coerces declared fields into {@code out}. A field is written when present with a non-null value
   * or when its type is required (which then fails on the missing value).
   */
  void coerceInto(Map<?, ?> value, Map<String, Object> out, String target) {
    fields.forEach((name, type) -> {
      Object raw = lookup(value, name);
      if (raw == null && type.isOptional()) return;
      try {
        out.put(name, type.coerce(raw));
      } catch (CoercionException e) {
        throw new CoercionException(value, target, "Field '" + name + "': " + e.getMessage(), e);
      }
    });
  }

  void copyUndeclared(Map<?, ?> value, Map<String, Object> out) {
    for (Map.Entry<?, ?> e : value.entrySet()) {
      String k = String.valueOf(e.getKey());
      if (!fields.containsKey(k)) out.put(k, e.getValue());
    }
  }

  void applyTo(Map<String, Object> schema) {
    if (fields.isEmpty()) return;
    Map<String, Object> properties = new LinkedHashMap<>();
    List<String> required = new ArrayList<>();
    fields.forEach((name, type) -> {
      properties.put(name, type.toJsonSchema());
      if (!type.isOptional()) required.add(name);
    });
    schema.put("properties", properties);
    if (!required.isEmpty()) schema.put("required", required);
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "{", "}");
    fields.forEach((name, type) -> j.add(name + ": " + type));
    return j.toString();
  }

  static Object lookup(Map<?, ?> map, String name) {
    if (map instanceof HashMap<?, ?>) {
      Object v = map.get(name);
      if (v != null) return v;
    }
    for (Map.Entry<?, ?> e : map.entrySet()) {
      if (e.getKey() != null && name.equals(String.valueOf(e.getKey()))) return e.getValue();
    }
    return null;
  }

  /** Parses {@code text} as a JSON object for {@code target}'s coercion. */
  static Map<?, ?> parseObject(String text, String target, String notAnObject) {
    Object parsed;
    try {
      parsed = JsonValues.parse(text);
    } catch (JsonProcessingException e) {
      throw new CoercionException(text, target, "Invalid JSON: " + JsonValues.describe(e), e);
    }
    if (!(parsed instanceof Map<?, ?> m)) throw new CoercionException(text, target, notAnObject);
    return m;
  }
}
