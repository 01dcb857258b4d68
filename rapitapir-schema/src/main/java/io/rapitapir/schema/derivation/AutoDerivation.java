package io.rapitapir.schema.derivation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rapitapir.types.BaseType;
import io.rapitapir.types.HashType;
import io.rapitapir.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigInteger;
import java.time.*;
import java.time.temporal.Temporal;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives {@link HashType} schemas from sample data, JSON-Schema documents and records.\n
 *
 * Inference from a sample value:\n
 * - integral numbers → Integer, other numbers → Float, booleans → Boolean\n
 * - {@code LocalDate} → Date; date-times, {@code Instant}, {@code java.util.Date} → DateTime\n
 * - lists and arrays → Array of the first element's type (String when empty)\n
 * - maps → an empty Hash\n
 * - strings, null and anything else → String\n
 *
 * Derived hashes allow additional properties.\n
 */
public final class AutoDerivation {
  private static final Logger log = LoggerFactory.getLogger(AutoDerivation.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private AutoDerivation() {}

  public static HashType fromMap(Object sample) {
    return fromMap(sample, FieldFilter.all());
  }

  public static HashType fromMap(Object sample, FieldFilter filter) {
    if (!(sample instanceof Map<?, ?> map)) throw new IllegalArgumentException("Expected Hash, got " + kindOf(sample));
    Map<String, BaseType> fields = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      String name = String.valueOf(e.getKey());
      if (!filter.includes(name)) continue;
      fields.put(name, infer(e.getValue()));
    }
    return done("map", fields);
  }

  /** Derives from a JSON sample document whose root is an object. */
  public static HashType fromJson(String json) {
    return fromJson(json, FieldFilter.all());
  }

  public static HashType fromJson(String json, FieldFilter filter) {
    JsonNode root = readTree(json);
    if (!root.isObject()) throw new IllegalArgumentException("Expected Hash, got " + root.getNodeType());
    Map<String, BaseType> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      if (!filter.includes(e.getKey())) continue;
      fields.put(e.getKey(), infer(e.getValue()));
    }
    return done("json", fields);
  }

  public static HashType fromJsonSchema(Map<String, ?> schema) {
    return fromJsonSchema(schema, FieldFilter.all());
  }

  /**
   * Root must be {@code {"type": "object"}}. Properties not listed under {@code required} become
   * {@link io.rapitapir.types.OptionalType}; array item types are always required.
   */
  public static HashType fromJsonSchema(Map<String, ?> schema, FieldFilter filter) {
    if (schema == null || !"object".equals(schema.get("type"))) {
      throw new IllegalArgumentException("JSON Schema must be an object type");
    }
    Object props = schema.get("properties");
    Map<?, ?> properties = props instanceof Map<?, ?> m ? m : Map.of();
    Set<String> required = new HashSet<>();
    if (schema.get("required") instanceof Collection<?> c) for (Object r : c) required.add(String.valueOf(r));

    Map<String, BaseType> fields = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : properties.entrySet()) {
      String name = String.valueOf(e.getKey());
      if (!filter.includes(name)) continue;
      fields.put(name, convert(e.getValue(), required.contains(name)));
    }
    return done("json-schema", fields);
  }

  public static HashType fromJsonSchema(String schemaJson) {
    return fromJsonSchema(schemaJson, FieldFilter.all());
  }

  @SuppressWarnings("unchecked")
  public static HashType fromJsonSchema(String schemaJson, FieldFilter filter) {
    JsonNode root = readTree(schemaJson);
    if (!root.isObject()) throw new IllegalArgumentException("JSON Schema must be an object type");
    return fromJsonSchema(JSON.convertValue(root, Map.class), filter);
  }

  /** Derives from the component values of a record; a null component falls back to its declared type. */
  public static HashType fromRecord(Record record) {
    return fromRecord(record, FieldFilter.all());
  }

  public static HashType fromRecord(Record record, FieldFilter filter) {
    if (record == null) throw new IllegalArgumentException("Expected Record, got null");
    Map<String, BaseType> fields = new LinkedHashMap<>();
    for (RecordComponent rc : record.getClass().getRecordComponents()) {
      if (!filter.includes(rc.getName())) continue;
      Object value = read(record, rc);
      fields.put(rc.getName(), value == null ? inferFromClass(rc.getType()) : infer(value));
    }
    return done("record", fields);
  }

  // ---- inference ----

  static BaseType infer(Object value) {
    if (value == null) return Types.string();
    if (isIntegral(value)) return Types.integer();
    if (value instanceof Number) return Types.floatType();
    if (value instanceof Boolean) return Types.bool();
    if (value instanceof LocalDate) return Types.date();
    if (value instanceof LocalDateTime || value instanceof OffsetDateTime || value instanceof ZonedDateTime
        || value instanceof Instant || value instanceof java.util.Date) {
      return Types.dateTime();
    }
    if (value instanceof JsonNode node) return infer(node);
    if (value instanceof List<?> l) return Types.array(l.isEmpty() ? Types.string() : infer(l.get(0)));
    if (value.getClass().isArray()) {
      int n = java.lang.reflect.Array.getLength(value);
      return Types.array(n == 0 ? Types.string() : infer(java.lang.reflect.Array.get(value, 0)));
    }
    if (value instanceof Map<?, ?>) return Types.hash();
    return Types.string();
  }

  static BaseType infer(JsonNode node) {
    if (node.isIntegralNumber()) return Types.integer();
    if (node.isNumber()) return Types.floatType();
    if (node.isBoolean()) return Types.bool();
    if (node.isArray()) return Types.array(node.isEmpty() ? Types.string() : infer(node.get(0)));
    if (node.isObject()) return Types.hash();
    return Types.string();
  }

  static BaseType inferFromClass(Class<?> type) {
    if (type == int.class || type == long.class || type == short.class || type == byte.class
        || type == Integer.class || type == Long.class || type == Short.class || type == Byte.class
        || type == BigInteger.class) {
      return Types.integer();
    }
    if (type == double.class || type == float.class || Number.class.isAssignableFrom(type)) return Types.floatType();
    if (type == boolean.class || type == Boolean.class) return Types.bool();
    if (type == LocalDate.class) return Types.date();
    if (Temporal.class.isAssignableFrom(type) || java.util.Date.class.isAssignableFrom(type)) return Types.dateTime();
    if (type.isArray()) return Types.array(inferFromClass(type.getComponentType()));
    if (Collection.class.isAssignableFrom(type)) return Types.array(Types.string());
    if (Map.class.isAssignableFrom(type)) return Types.hash();
    return Types.string();
  }

  static BaseType convert(Object fieldSchema, boolean required) {
    Map<?, ?> s = fieldSchema instanceof Map<?, ?> m ? m : Map.of();
    BaseType base;
    switch (String.valueOf(s.get("type"))) {
      case "string":
        base = stringOfFormat(s.get("format"));
        break;
      case "integer":
        base = Types.integer();
        break;
      case "number":
        base = Types.floatType();
        break;
      case "boolean":
        base = Types.bool();
        break;
      case "array":
        base = Types.array(s.get("items") == null ? Types.string() : convert(s.get("items"), true));
        break;
      case "object":
        base = Types.hash();
        break;
      default:
        base = Types.string();
    }
    return required ? base : Types.optional(base);
  }

  private static BaseType stringOfFormat(Object format) {
    if ("email".equals(format)) return Types.email();
    if ("uuid".equals(format)) return Types.uuid();
    if ("date".equals(format)) return Types.date();
    if ("date-time".equals(format)) return Types.dateTime();
    return Types.string();
  }

  // ---- helpers ----

  private static HashType done(String source, Map<String, BaseType> fields) {
    HashType out = Types.hash(fields);
    if (log.isDebugEnabled()) {
      log.debug("rapitapir.derive source={} fields={}", source, fields.keySet());
    }
    return out;
  }

  private static JsonNode readTree(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static Object read(Record record, RecordComponent rc) {
    try {
      java.lang.reflect.Method accessor = rc.getAccessor();
      accessor.setAccessible(true);
      return accessor.invoke(record);
    } catch (IllegalAccessException | InvocationTargetException e) {
      throw new IllegalStateException("Failed to read component '" + rc.getName() + "' of "
          + record.getClass().getName(), e);
    }
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
        || value instanceof BigInteger || value instanceof AtomicInteger || value instanceof AtomicLong;
  }

  private static String kindOf(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
