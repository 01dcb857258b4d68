package io.rapitapir.types;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Makes the wrapped type accept {@code null}. Everything else is delegated, including metadata and
 * coercion policy; the JSON schema is the wrapped one (optionality shows in the parent's
 * {@code required} list).
 */
public final class OptionalType extends BaseType {
  final BaseType wrapped;

  OptionalType(BaseType wrapped) {
    super(new Attributes(true, wrapped.metadata(), wrapped.coercionPolicy()));
    this.wrapped = Objects.requireNonNull(wrapped, "wrapped");
  }

  public BaseType wrappedType() { return wrapped; }

  @Override
  public ValidationResult validate(Object value) {
    if (value == null) return ValidationResult.ok();
    return wrapped.validate(value);
  }

  @Override
  public Object coerce(Object value) {
    if (value == null) return null;
    return wrapped.coerce(value);
  }

  @Override
  public Map<String, Object> toJsonSchema() {
    return wrapped.toJsonSchema();
  }

  /** Re-wraps the inner type carrying the new metadata and policy; the result stays optional. */
  @Override
  BaseType withAttributes(Attributes attrs) {
    Attributes inner = new Attributes(wrapped.attrs.optional(), attrs.metadata(), attrs.coercion());
    return new OptionalType(wrapped.withAttributes(inner));
  }

  @Override String typeName() { return wrapped.typeName(); }
  @Override String jsonType() { return wrapped.jsonType(); }

  @Override
  List<String> validateType(Object value) {
    return wrapped.validateType(value);
  }

  @Override
  List<String> validateConstraints(Object value) {
    return wrapped.validateConstraints(value);
  }

  @Override
  Object coerceValue(Object value) {
    return wrapped.coerceValue(value);
  }

  @Override
  void describeConstraints(Map<String, Object> out) {
    wrapped.describeConstraints(out);
  }

  @Override
  public String toString() {
    return "Optional[" + wrapped + "]";
  }
}
