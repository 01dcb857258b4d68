package io.rapitapir.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.rapitapir.types.json.JsonValues;

import java.util.*;

/**
 * Homogeneous list. Accepts {@code List}s and Java arrays; coercion produces an {@code ArrayList}.
 * <p>
 * Every element is validated, so one call reports all bad items with their index.
 */
public final class ArrayType extends BaseType {
  final BaseType itemType;
  final Integer minItems;
  final Integer maxItems;
  final boolean uniqueItems;

  ArrayType(Attributes attrs, BaseType itemType, Integer minItems, Integer maxItems, boolean uniqueItems) {
    super(attrs);
    this.itemType = Objects.requireNonNull(itemType, "itemType");
    if (minItems != null && minItems < 0) throw new IllegalArgumentException("min_items must be >= 0: " + minItems);
    if (maxItems != null && maxItems < 0) throw new IllegalArgumentException("max_items must be >= 0: " + maxItems);
    if (minItems != null && maxItems != null && minItems > maxItems) {
      throw new IllegalArgumentException("min_items " + minItems + " exceeds max_items " + maxItems);
    }
    this.minItems = minItems;
    this.maxItems = maxItems;
    this.uniqueItems = uniqueItems;
  }

  public BaseType itemType() { return itemType; }
  public Integer minItems() { return minItems; }
  public Integer maxItems() { return maxItems; }
  public boolean uniqueItems() { return uniqueItems; }

  public ArrayType withMinItems(Integer minItems) {
    return new ArrayType(attrs, itemType, minItems, maxItems, uniqueItems);
  }

  public ArrayType withMaxItems(Integer maxItems) {
    return new ArrayType(attrs, itemType, minItems, maxItems, uniqueItems);
  }

  public ArrayType withUniqueItems(boolean uniqueItems) {
    return new ArrayType(attrs, itemType, minItems, maxItems, uniqueItems);
  }

  @Override
  BaseType withAttributes(Attributes attrs) {
    return new ArrayType(attrs, itemType, minItems, maxItems, uniqueItems);
  }

  @Override String typeName() { return "Array"; }
  @Override String jsonType() { return "array"; }

  @Override
  List<String> validateType(Object value) {
    if (Values.asList(value) == null) return List.of("Expected array, got " + Values.typeName(value));
    return List.of();
  }

  @Override
  List<String> validateConstraints(Object value) {
    List<Object> items = Values.asList(value);
    if (items == null) return List.of();
    List<String> errors = new ArrayList<>();
    int n = items.size();
    if (minItems != null && n < minItems) errors.add("Array length " + n + " is below minimum " + minItems);
    if (maxItems != null && n > maxItems) errors.add("Array length " + n + " exceeds maximum " + maxItems);
    if (uniqueItems && new HashSet<>(items).size() != n) {
      errors.add("Array contains duplicate items but must be unique");
    }
    for (int i = 0; i < n; i++) {
      for (String e : itemType.validate(items.get(i)).errors()) errors.add("Item at index " + i + ": " + e);
    }
    return errors;
  }

  @Override
  Object coerceValue(Object value) {
    List<Object> items = Values.asList(value, true);
    if (items != null) return coerceItems(value, items);
    if (value instanceof String s) return coerceItems(value, parseArray(s));
    if (coercionPolicy().isStrict()) {
      throw new CoercionException(value, typeName(), "Value of type " + Values.typeName(value) + " is not an array");
    }
    // scalar becomes a one-element list
    return coerceItems(value, List.of(value));
  }

  private List<Object> coerceItems(Object source, List<?> items) {
    List<Object> out = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      try {
        out.add(itemType.coerce(items.get(i)));
      } catch (CoercionException e) {
        throw new CoercionException(source, typeName(), "Item at index " + i + ": " + e.getMessage(), e);
      }
    }
    return out;
  }

  private List<?> parseArray(String text) {
    Object parsed;
    try {
      parsed = JsonValues.parse(text);
    } catch (JsonProcessingException e) {
      throw new CoercionException(text, typeName(), "Invalid JSON: " + JsonValues.describe(e), e);
    }
    if (!(parsed instanceof List<?> l)) throw new CoercionException(text, typeName(), "JSON string did not parse to array");
    return l;
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    out.put("min_items", minItems);
    out.put("max_items", maxItems);
    if (uniqueItems) out.put("unique_items", true);
  }

  @Override
  void applyConstraintsToSchema(Map<String, Object> schema) {
    schema.put("items", itemType.toJsonSchema());
    if (minItems != null) schema.put("minItems", minItems);
    if (maxItems != null) schema.put("maxItems", maxItems);
    if (uniqueItems) schema.put("uniqueItems", true);
  }

  @Override
  public String toString() {
    String base = "Array[" + itemType + "]";
    String rest = super.toString();
    // super renders "Array" or "Array(k: v, ...)"
    return base + rest.substring(typeName().length());
  }
}
