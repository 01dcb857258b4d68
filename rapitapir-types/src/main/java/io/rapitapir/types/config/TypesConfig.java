package io.rapitapir.types.config;

import io.rapitapir.types.CoercionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Library-wide defaults.
 * <p>
 * Resolved once from the optional classpath resource {@value #RESOURCE}, then JVM system properties
 * (system properties win). Invalid values fall back to the defaults.
 */
public final class TypesConfig {
  private static final Logger log = LoggerFactory.getLogger(TypesConfig.class);

  public static final String RESOURCE = "rapitapir-types.properties";
  public static final String COERCION_KEY = "rapitapir.types.coercion";
  public static final String ZONE_KEY = "rapitapir.types.zone";

  private static final TypesConfig DEFAULTS = new TypesConfig(CoercionPolicy.LENIENT, ZoneOffset.UTC);

  private final CoercionPolicy coercionPolicy;
  private final ZoneId zone;

  public TypesConfig(CoercionPolicy coercionPolicy, ZoneId zone) {
    this.coercionPolicy = Objects.requireNonNull(coercionPolicy, "coercionPolicy");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public static TypesConfig defaults() { return DEFAULTS; }

  /** Process-wide configuration (resource + system properties). */
  public static TypesConfig global() { return Holder.INSTANCE; }

  public CoercionPolicy coercionPolicy() { return coercionPolicy; }
  public ZoneId zone() { return zone; }

  public static TypesConfig from(Properties p) {
    Objects.requireNonNull(p, "properties");
    CoercionPolicy policy = parsePolicy(p.getProperty(COERCION_KEY));
    ZoneId zone = parseZone(p.getProperty(ZONE_KEY));
    return new TypesConfig(policy, zone);
  }

  static TypesConfig load(ClassLoader cl) {
    Properties merged = new Properties();
    if (cl == null) cl = TypesConfig.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) merged.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
    for (String key : new String[] {COERCION_KEY, ZONE_KEY}) {
      String v = System.getProperty(key);
      if (v != null) merged.setProperty(key, v);
    }
    TypesConfig cfg = from(merged);
    if (log.isDebugEnabled()) {
      log.debug("rapitapir.config coercion={} zone={}", cfg.coercionPolicy, cfg.zone);
    }
    return cfg;
  }

  private static CoercionPolicy parsePolicy(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULTS.coercionPolicy;
    try {
      return CoercionPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      log.warn("rapitapir.config invalid {}='{}', using {}", COERCION_KEY, raw, DEFAULTS.coercionPolicy);
      return DEFAULTS.coercionPolicy;
    }
  }

  private static ZoneId parseZone(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULTS.zone;
    try {
      return ZoneId.of(raw.trim());
    } catch (DateTimeException e) {
      log.warn("rapitapir.config invalid {}='{}', using {}", ZONE_KEY, raw, DEFAULTS.zone);
      return DEFAULTS.zone;
    }
  }

  @Override
  public String toString() {
    return "TypesConfig{coercion=" + coercionPolicy + ", zone=" + zone + "}";
  }

  private static final class Holder {
    static final TypesConfig INSTANCE = load(Thread.currentThread().getContextClassLoader());
  }
}
