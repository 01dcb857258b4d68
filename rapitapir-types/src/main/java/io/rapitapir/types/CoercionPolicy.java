package io.rapitapir.types;

/**
 * How forgiving a type is when converting foreign values.
 * <p>
 * {@link #LENIENT} keeps the permissive fallbacks (truthiness for booleans, truncation of fractional
 * numbers, boxing a scalar into a one-element array, {@code String.valueOf} for arbitrary objects).
 * {@link #STRICT} rejects those conversions with a {@link CoercionException}.
 */
public enum CoercionPolicy {
  LENIENT,
  STRICT;

  public boolean isStrict() {
    return this == STRICT;
  }
}
