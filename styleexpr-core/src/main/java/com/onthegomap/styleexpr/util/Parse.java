package com.onthegomap.styleexpr.util;

import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Utilities to parse values from strings.
 */
public class Parse {

  private static final NumberFormat PARSER = NumberFormat.getNumberInstance(Locale.ROOT);

  private Parse() {}

  /** Returns {@code value} as a double or null if invalid. */
  public static Double parseDoubleOrNull(Object value) {
    try {
      return value == null ? null : value instanceof Number number ? number.doubleValue() :
        Double.parseDouble(value.toString().strip());
    } catch (NumberFormatException e) {
      return retryParseNumber(value.toString().strip());
    }
  }

  private static Double retryParseNumber(String value) {
    // accept what NumberFormat accepts (like "1,000") but only when it consumes the entire string
    var position = new ParsePosition(0);
    Number result;
    synchronized (PARSER) {
      result = PARSER.parse(value, position);
    }
    return result == null || value.isEmpty() || position.getIndex() != value.length() ? null : result.doubleValue();
  }

  /** Returns {@code value} like {@code "50%"} as a fraction like {@code 0.5}, or null if it is not a percentage. */
  public static Double parsePercentOrNull(String value) {
    if (value == null) {
      return null;
    }
    String stripped = value.strip();
    if (!stripped.endsWith("%")) {
      return null;
    }
    Double result = parseDoubleOrNull(stripped.substring(0, stripped.length() - 1));
    return result == null ? null : result / 100d;
  }
}
