package io.rapitapir.types.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses JSON text into plain Java values: {@code Map}, {@code List}, {@code String}, numbers,
 * {@code Boolean} or {@code null}. Integral numbers come back as {@code Integer}, {@code Long} or
 * {@code BigInteger}; fractional numbers as {@code Double}.
 */
public final class JsonValues {
  private static final ObjectMapper JSON = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private JsonValues() {}

  public static Object parse(String text) throws JsonProcessingException {
    return JSON.readValue(text, Object.class);
  }

  /** Parser message without Jackson's source-location suffix. */
  public static String describe(JsonProcessingException e) {
    String m = e.getOriginalMessage();
    return m == null ? e.getClass().getSimpleName() : m;
  }

  static ObjectMapper mapper() {
    return JSON;
  }
}
