package io.rapitapir.types;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Entry point for building types.
 *
 * <pre>{@code
 * ObjectType user = Types.object(o -> o
 *     .field("name", Types.string().withMinLength(1))
 *     .optionalField("age", Types.integer().withMinimum(0)));
 * }</pre>
 */
public final class Types {
  private Types() {}

  public static StringType string() {
    return new StringType(BaseType.Attributes.defaults(), null, null, null, null);
  }

  public static IntegerType integer() {
    return new IntegerType(BaseType.Attributes.defaults(), NumericBounds.NONE);
  }

  public static FloatType floatType() {
    return new FloatType(BaseType.Attributes.defaults(), NumericBounds.NONE);
  }

  public static BooleanType bool() {
    return new BooleanType(BaseType.Attributes.defaults());
  }

  public static DateType date() {
    return new DateType(BaseType.Attributes.defaults(), null);
  }

  public static DateTimeType dateTime() {
    return new DateTimeType(BaseType.Attributes.defaults(), null);
  }

  public static UuidType uuid() {
    return new UuidType(BaseType.Attributes.defaults(), null, null);
  }

  public static EmailType email() {
    return new EmailType(BaseType.Attributes.defaults(), null, null);
  }

  public static ArrayType array(BaseType itemType) {
    return new ArrayType(BaseType.Attributes.defaults(), itemType, null, null, false);
  }

  public static HashType hash() {
    return new HashType(BaseType.Attributes.defaults(), FieldSet.EMPTY, true);
  }

  public static HashType hash(Map<String, ? extends BaseType> fields) {
    return new HashType(BaseType.Attributes.defaults(), new FieldSet(Objects.requireNonNull(fields, "fields")), true);
  }

  public static ObjectType object() {
    return new ObjectType(BaseType.Attributes.defaults(), FieldSet.EMPTY);
  }

  public static ObjectType object(Consumer<ObjectType.Builder> fields) {
    ObjectType.Builder b = new ObjectType.Builder(object());
    fields.accept(b);
    return b.build();
  }

  public static OptionalType optional(BaseType type) {
    return new OptionalType(type);
  }
}
