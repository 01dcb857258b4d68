package io.rapitapir.types.config;

import io.rapitapir.types.CoercionPolicy;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class TypesConfigTest {

  private static Properties props(String coercion, String zone) {
    Properties p = new Properties();
    if (coercion != null) p.setProperty(TypesConfig.COERCION_KEY, coercion);
    if (zone != null) p.setProperty(TypesConfig.ZONE_KEY, zone);
    return p;
  }

  @Test
  void defaultsAreLenientUtc() {
    TypesConfig c = TypesConfig.from(new Properties());
    assertEquals(CoercionPolicy.LENIENT, c.coercionPolicy());
    assertEquals(ZoneOffset.UTC, c.zone());
    assertEquals(TypesConfig.defaults().coercionPolicy(), c.coercionPolicy());
  }

  @Test
  void readsExplicitValues() {
    TypesConfig c = TypesConfig.from(props(" Strict ", "Europe/Berlin"));
    assertEquals(CoercionPolicy.STRICT, c.coercionPolicy());
    assertEquals(ZoneId.of("Europe/Berlin"), c.zone());
  }

  @Test
  void invalidValuesFallBack() {
    TypesConfig c = TypesConfig.from(props("sloppy", "Mars/Olympus"));
    assertEquals(CoercionPolicy.LENIENT, c.coercionPolicy());
    assertEquals(ZoneOffset.UTC, c.zone());
  }

  @Test
  void loadsClasspathResource() {
    ClassLoader cl = new ClassLoader(getClass().getClassLoader()) {
      @Override
      public InputStream getResourceAsStream(String name) {
        if (!TypesConfig.RESOURCE.equals(name)) return super.getResourceAsStream(name);
        String body = TypesConfig.COERCION_KEY + "=strict\n" + TypesConfig.ZONE_KEY + "=+02:00\n";
        return new ByteArrayInputStream(body.getBytes(StandardCharsets.ISO_8859_1));
      }
    };
    TypesConfig c = TypesConfig.load(cl);
    assertEquals(CoercionPolicy.STRICT, c.coercionPolicy());
    assertEquals(ZoneOffset.ofHours(2), c.zone());
  }

  @Test
  void globalIsResolvedOnce() {
    assertSame(TypesConfig.global(), TypesConfig.global());
  }
}
