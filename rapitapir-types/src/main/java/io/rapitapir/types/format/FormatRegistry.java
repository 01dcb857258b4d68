package io.rapitapir.types.format;

import java.util.Optional;
import java.util.Set;

/** Lookup of string format validators by name (case-insensitive). */
public interface FormatRegistry {
  Optional<FormatValidator> find(String name);

  /** Every resolvable name, aliases included. */
  Set<String> names();

  /** Registry discovered from the context class loader on first use. */
  static FormatRegistry global() {
    return DiscoveredFormatRegistry.Holder.INSTANCE;
  }
}
