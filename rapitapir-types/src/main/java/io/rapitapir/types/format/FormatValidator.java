package io.rapitapir.types.format;

import java.util.List;
import java.util.Set;

/** A named check applied to strings by {@code StringType.withFormat(name)}. */
public interface FormatValidator {
  /** Canonical format name, e.g. {@code email}. */
  String name();

  /** Additional names resolving to this validator, e.g. {@code url} for {@code uri}. */
  default Set<String> aliases() {
    return Set.of();
  }

  /** Error messages for {@code value}; empty when it conforms. Must not throw. */
  List<String> validate(String value);
}
