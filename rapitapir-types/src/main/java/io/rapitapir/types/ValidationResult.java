package io.rapitapir.types;

import java.util.List;

/**
 * Outcome of {@link BaseType#validate(Object)}.
 *
 * @param valid       true when no error was found
 * @param errors      human-readable errors in discovery order (path-qualified for composites)
 * @param valueErrors one aggregated {@link ValidationException} per failed result; empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors, List<ValidationException> valueErrors) {
  private static final ValidationResult OK = new ValidationResult(true, List.of(), List.of());

  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
    valueErrors = valueErrors == null ? List.of() : List.copyOf(valueErrors);
  }

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult of(BaseType type, Object value, List<String> errors) {
    if (errors == null || errors.isEmpty()) return OK;
    return new ValidationResult(false, errors, List.of(ValidationException.detached(value, type, errors)));
  }
}
