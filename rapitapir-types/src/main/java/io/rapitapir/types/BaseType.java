package io.rapitapir.types;

import io.rapitapir.types.config.TypesConfig;

import java.util.*;

/**
 * Root of the type hierarchy.\n
 *
 * A type is an immutable schema node. Every {@code withX(...)} call returns a new instance; nothing
 * mutates after construction, so one instance can validate and coerce from many threads.\n
 *
 * Validation runs in two phases, both always executed so callers see every problem at once:\n
 * - {@link #validateType(Object)}: is the value of the right shape\n
 * - {@link #validateConstraints(Object)}: bounds, patterns, nested fields and items\n
 *
 * Coercion is transactional: the first failure raises {@link CoercionException}.\n
 */
public abstract sealed class BaseType
    permits StringType, IntegerType, FloatType, BooleanType, DateType, DateTimeType,
            ArrayType, HashType, ObjectType, OptionalType {

  static final String REQUIRED_ERROR = "Value is required but got nil";

  final Attributes attrs;

  BaseType(Attributes attrs) {
    this.attrs = Objects.requireNonNull(attrs, "attrs");
  }

  // ---- public contract ----

  public ValidationResult validate(Object value) {
    if (value == null) {
      return isRequired() ? ValidationResult.of(this, null, List.of(REQUIRED_ERROR)) : ValidationResult.ok();
    }
    List<String> errors = new ArrayList<>(validateType(value));
    errors.addAll(validateConstraints(value));
    return ValidationResult.of(this, value, errors);
  }

  public Object coerce(Object value) {
    if (value == null) {
      if (isOptional()) return null;
      throw new CoercionException(null, typeName(), "Required value cannot be nil");
    }
    try {
      return coerceValue(value);
    } catch (CoercionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CoercionException(value, typeName(), e.getMessage(), e);
    }
  }

  public boolean isRequired() {
    return !isOptional();
  }

  public boolean isOptional() {
    return attrs.optional();
  }

  public CoercionPolicy coercionPolicy() {
    return attrs.coercion();
  }

  public Map<String, Object> metadata() {
    return attrs.metadata();
  }

  /** Constraint values by their snake_case name, in declaration order; unset constraints are omitted. */
  public Map<String, Object> constraints() {
    Map<String, Object> out = new LinkedHashMap<>();
    describeConstraints(out);
    out.values().removeIf(Objects::isNull);
    if (attrs.optional()) out.put("optional", true);
    return Collections.unmodifiableMap(out);
  }

  /** JSON-Schema fragment; a fresh, insertion-ordered map on every call. */
  public Map<String, Object> toJsonSchema() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", jsonType());
    Object description = metadata().get("description");
    if (description != null) schema.put("description", description);
    Object example = metadata().get("example");
    if (example != null) schema.put("example", example);
    applyConstraintsToSchema(schema);
    return schema;
  }

  public BaseType withMetadata(Map<String, ?> meta) {
    Objects.requireNonNull(meta, "meta");
    Map<String, Object> merged = new LinkedHashMap<>(metadata());
    for (Map.Entry<String, ?> e : meta.entrySet()) {
      merged.put(Objects.requireNonNull(e.getKey(), "metadata key"), e.getValue());
    }
    return withAttributes(attrs.withMetadata(merged));
  }

  public BaseType withDescription(String description) {
    return withMetadata(Collections.singletonMap("description", description));
  }

  public BaseType withExample(Object example) {
    return withMetadata(Collections.singletonMap("example", example));
  }

  public BaseType withOptional(boolean optional) {
    return withAttributes(attrs.withOptional(optional));
  }

  public BaseType withCoercion(CoercionPolicy policy) {
    return withAttributes(attrs.withCoercion(Objects.requireNonNull(policy, "policy")));
  }

  @Override
  public String toString() {
    Map<String, Object> c = constraints();
    if (c.isEmpty()) return typeName();
    StringJoiner j = new StringJoiner(", ", typeName() + "(", ")");
    c.forEach((k, v) -> j.add(k + ": " + v));
    return j.toString();
  }

  // ---- override points ----

  /** Name used in messages and {@link CoercionException#targetType()}. */
  abstract String typeName();

  abstract String jsonType();

  abstract List<String> validateType(Object value);

  abstract List<String> validateConstraints(Object value);

  abstract Object coerceValue(Object value);

  abstract void describeConstraints(Map<String, Object> out);

  void applyConstraintsToSchema(Map<String, Object> schema) {}

  abstract BaseType withAttributes(Attributes attrs);

  /** Flags shared by every kind: optionality, descriptive metadata and coercion policy. */
  record Attributes(boolean optional, Map<String, Object> metadata, CoercionPolicy coercion) {
    Attributes {
      metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
      Objects.requireNonNull(coercion, "coercion");
    }

    static Attributes defaults() {
      return new Attributes(false, Map.of(), TypesConfig.global().coercionPolicy());
    }

    Attributes withOptional(boolean optional) {
      return new Attributes(optional, metadata, coercion);
    }

    Attributes withMetadata(Map<String, Object> metadata) {
      return new Attributes(optional, metadata, coercion);
    }

    Attributes withCoercion(CoercionPolicy coercion) {
      return new Attributes(optional, metadata, coercion);
    }
  }
}
