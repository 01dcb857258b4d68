package io.rapitapir.types.format;

import io.rapitapir.types.util.RapiTapirFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * FormatRegistry built via discovery (META-INF/rapitapir.factories).\n
 *
 * Lookup order:\n
 * - canonical names, first registration wins\n
 * - aliases, only when no canonical name claims them\n
 * - empty (unknown formats impose no check)\n
 */
public final class DiscoveredFormatRegistry implements FormatRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredFormatRegistry.class);

  private final Map<String, FormatValidator> byName;

  public DiscoveredFormatRegistry(ClassLoader cl) {
    this(RapiTapirFactoriesLoader.load(FormatValidatorProvider.class, cl));
  }

  public DiscoveredFormatRegistry(List<FormatValidatorProvider> providers) {
    Map<String, FormatValidator> canonical = new LinkedHashMap<>();
    Map<String, FormatValidator> aliases = new LinkedHashMap<>();

    for (FormatValidatorProvider p : providers) {
      if (p == null) continue;
      Collection<FormatValidator> validators = p.formatValidators();
      if (validators == null) continue;
      for (FormatValidator fv : validators) {
        if (fv == null) continue;
        // keep first discovered for determinism
        canonical.putIfAbsent(normalize(fv.name()), fv);
        for (String alias : fv.aliases()) aliases.putIfAbsent(normalize(alias), fv);
      }
    }

    Map<String, FormatValidator> all = new LinkedHashMap<>(canonical);
    aliases.forEach(all::putIfAbsent);
    this.byName = Collections.unmodifiableMap(all);

    if (log.isDebugEnabled()) {
      log.debug("rapitapir.formats providers={} names={}", providers.size(), byName.keySet());
    }
  }

  @Override
  public Optional<FormatValidator> find(String name) {
    if (name == null || name.isBlank()) return Optional.empty();
    return Optional.ofNullable(byName.get(normalize(name)));
  }

  @Override
  public Set<String> names() {
    return byName.keySet();
  }

  private static String normalize(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Format name is blank");
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }

  static final class Holder {
    static final FormatRegistry INSTANCE = new DiscoveredFormatRegistry(Thread.currentThread().getContextClassLoader());

    private Holder() {}
  }
}
