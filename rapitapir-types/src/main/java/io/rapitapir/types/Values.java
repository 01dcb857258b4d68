package io.rapitapir.types;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Shape checks and conversions shared by the type kinds. */
final class Values {
  private Values() {}

  static String inspect(Object value) {
    if (value == null) return "null";
    if (value instanceof CharSequence cs) return "\"" + cs + "\"";
    if (value.getClass().isArray()) return String.valueOf(asList(value));
    return String.valueOf(value);
  }

  static String typeName(Object value) {
    if (value == null) return "null";
    if (value instanceof Map<?, ?>) return "Map";
    if (value instanceof List<?>) return "List";
    return value.getClass().getSimpleName();
  }

  static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger
        || value instanceof AtomicInteger || value instanceof AtomicLong;
  }

  static boolean isNumber(Object value) {
    return value instanceof Number && !(value instanceof Character);
  }

  static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof BigInteger bi) return new BigDecimal(bi);
    if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
    return BigDecimal.valueOf(n.doubleValue());
  }

  static boolean isFinite(Number n) {
    if (n instanceof Double d) return Double.isFinite(d);
    if (n instanceof Float f) return Float.isFinite(f);
    return true;
  }

  /** Exact long value of an integral number; {@code ArithmeticException} beyond the long range. */
  static long longValueExact(Number n) {
    return n instanceof BigInteger bi ? bi.longValueExact() : n.longValue();
  }

  /** Narrows to {@code Long} when the value fits, otherwise keeps the {@code BigInteger}. */
  static Number narrow(BigInteger bi) {
    return bi.bitLength() < 64 ? (Number) bi.longValue() : bi;
  }

  /** A list view of a {@code List}, any Java array or (when {@code acceptCollections}) a collection; else null. */
  static List<Object> asList(Object value, boolean acceptCollections) {
    if (value instanceof List<?> l) return new ArrayList<>(l);
    if (value != null && value.getClass().isArray()) {
      int n = Array.getLength(value);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(value, i));
      return out;
    }
    if (acceptCollections && value instanceof Collection<?> c) return new ArrayList<>(c);
    return null;
  }

  static List<Object> asList(Object value) {
    return asList(value, false);
  }
}
