package io.rapitapir.types.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Classpath SPI loader for rapitapir extensions.\n
 *
 * Reads every {@code META-INF/rapitapir.factories} resource visible to the class loader.\n
 * Each resource is a Java Properties file keyed by the SPI interface name:\n
 *\n
 * <pre>\n
 * io.rapitapir.types.format.FormatValidatorProvider=com.acme.PhoneFormats,com.acme.IsbnFormats\n
 * </pre>\n
 *
 * Values may be comma-separated; whitespace is ignored; duplicates keep their first position.\n
 */
public final class RapiTapirFactoriesLoader {
  public static final String RESOURCE = "META-INF/rapitapir.factories";

  private RapiTapirFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = RapiTapirFactoriesLoader.class.getClassLoader();

    List<String> implNames = new ArrayList<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    LinkedHashSet<String> uniq = new LinkedHashSet<>(implNames);
    List<T> out = new ArrayList<>(uniq.size());
    for (String implName : uniq) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("SPI implementation " + implName + " not found for " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
