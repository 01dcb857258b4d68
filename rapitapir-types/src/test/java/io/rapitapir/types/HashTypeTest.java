package io.rapitapir.types;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class HashTypeTest {

  private static Map<String, Object> ordered(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  private static HashType person() {
    Map<String, BaseType> fields = new LinkedHashMap<>();
    fields.put("name", Types.string());
    fields.put("age", Types.optional(Types.integer()));
    return Types.hash(fields);
  }

  @Test
  void validatesDeclaredFieldsWithPath() {
    assertTrue(person().validate(Map.of("name", "Ada")).valid());
    assertEquals(List.of("Field 'name': Value is required but got nil"), person().validate(Map.of()).errors());
    assertEquals(List.of("Field 'name': Expected string, got Integer", "Field 'age': Expected integer, got String"),
        person().validate(ordered("name", 1, "age", "x")).errors());
    assertEquals(List.of("Expected hash/object, got List"), person().validate(List.of()).errors());
  }

  @Test
  void additionalPropertiesAreAllowedByDefault() {
    assertTrue(person().validate(Map.of("name", "Ada", "extra", 1)).valid());
  }

  @Test
  void strictHashReportsUnexpectedFields() {
    HashType strict = person().withAdditionalProperties(false);
    assertEquals(List.of("Unexpected fields: x, y"), strict.validate(ordered("name", "Ada", "x", 1, "y", 2)).errors());
  }

  @Test
  void nonStringKeysMatchByText() {
    Map<Object, Object> m = new HashMap<>();
    m.put(new StringBuilder("name"), "Ada");
    assertTrue(person().validate(m).valid());
    assertEquals(Map.of("name", "Ada"), person().coerce(m));
  }

  @Test
  void coercesFieldsAndKeepsExtras() {
    Object out = person().coerce(ordered("name", "Ada", "age", "36", "extra", true));
    assertEquals(ordered("name", "Ada", "age", 36L, "extra", true), out);
    assertEquals(List.of("name", "age", "extra"), List.copyOf(((Map<?, ?>) out).keySet()));
  }

  @Test
  void absentOptionalFieldIsLeftOut() {
    assertEquals(Map.of("name", "Ada"), person().coerce(Map.of("name", "Ada")));
  }

  @Test
  void strictHashDropsExtrasOnCoercion() {
    assertEquals(Map.of("name", "Ada"), person().withAdditionalProperties(false).coerce(Map.of("name", "Ada", "x", 1)));
  }

  @Test
  void missingRequiredFieldFailsCoercion() {
    CoercionException e = assertThrows(CoercionException.class, () -> person().coerce(Map.of("age", 3)));
    assertEquals("Hash", e.targetType());
    assertTrue(e.reason().startsWith("Field 'name': "), e.reason());
  }

  @Test
  void coercesJsonText() {
    assertEquals(Map.of("name", "Ada", "age", 36L), person().coerce("{\"name\": \"Ada\", \"age\": \"36\"}"));

    CoercionException notObject = assertThrows(CoercionException.class, () -> person().coerce("[1]"));
    assertEquals("JSON string did not parse to hash", notObject.reason());
    CoercionException other = assertThrows(CoercionException.class, () -> person().coerce(5));
    assertEquals("Value cannot be converted to hash", other.reason());
  }

  @Test
  void schemaListsRequiredFields() {
    Map<String, Object> schema = person().toJsonSchema();
    assertEquals(List.of("type", "properties", "required", "additionalProperties"), List.copyOf(schema.keySet()));
    assertEquals(Map.of("name", Map.of("type", "string"), "age", Map.of("type", "integer")), schema.get("properties"));
    assertEquals(List.of("name"), schema.get("required"));
    assertEquals(true, schema.get("additionalProperties"));
  }

  @Test
  void emptyHash() {
    assertEquals(Map.of("type", "object", "additionalProperties", true), Types.hash().toJsonSchema());
    assertEquals("Hash", Types.hash().toString());
    assertEquals("Hash{name: String, age: Optional[Integer]}", person().toString());
  }

  @Test
  void withFieldReturnsNewInstance() {
    HashType base = Types.hash();
    HashType grown = base.withField("id", Types.uuid());
    assertTrue(base.fieldTypes().isEmpty());
    assertEquals(List.of("id"), List.copyOf(grown.fieldTypes().keySet()));
  }
}
