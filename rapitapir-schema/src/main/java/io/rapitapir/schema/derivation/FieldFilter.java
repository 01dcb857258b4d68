package io.rapitapir.schema.derivation;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Field selection for derivation. {@code only} (when set) keeps the listed names; {@code except}
 * then drops names. Both are applied before any type is inferred.
 */
public record FieldFilter(Set<String> only, Set<String> except) {
  private static final FieldFilter ALL = new FieldFilter(null, Set.of());

  public FieldFilter {
    only = only == null ? null : Set.copyOf(only);
    except = except == null ? Set.of() : Set.copyOf(except);
  }

  public static FieldFilter all() {
    return ALL;
  }

  public static FieldFilter only(String... names) {
    return only(Arrays.asList(names));
  }

  public static FieldFilter only(Collection<String> names) {
    return new FieldFilter(new LinkedHashSet<>(Objects.requireNonNull(names, "names")), Set.of());
  }

  public static FieldFilter except(String... names) {
    return new FieldFilter(null, new LinkedHashSet<>(Arrays.asList(names)));
  }

  /** Also drops {@code names}. */
  public FieldFilter andExcept(String... names) {
    Set<String> next = new LinkedHashSet<>(except);
    next.addAll(Arrays.asList(names));
    return new FieldFilter(only, next);
  }

  public boolean includes(String name) {
    if (only != null && !only.contains(name)) return false;
    return !except.contains(name);
  }
}
