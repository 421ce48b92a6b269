package io.intellixity.sqlgate.tools.model;

import java.math.BigDecimal;
import java.util.Locale;

/** Text rendering of result cells. */
public final class ValueFormat {
  private ValueFormat() {}

  /** {@code null} for nulls; fractional floats to at most three decimals without trailing zeros. */
  public static String cell(Object value) {
    if (value == null) return "null";
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isFinite(d) && d != Math.rint(d)) return trimZeros(String.format(Locale.ROOT, "%.3f", d));
      return value.toString();
    }
    if (value instanceof BigDecimal bd) return bd.toPlainString();
    return value.toString();
  }

  static String trimZeros(String s) {
    if (s.indexOf('.') < 0) return s;
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '0') end--;
    if (end > 0 && s.charAt(end - 1) == '.') end--;
    return s.substring(0, end);
  }

  static String padRight(String s, int width) {
    if (s.length() >= width) return s;
    return s + " ".repeat(width - s.length());
  }
}
