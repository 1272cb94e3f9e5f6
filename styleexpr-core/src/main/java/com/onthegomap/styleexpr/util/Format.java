package com.onthegomap.styleexpr.util;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  private Format() {}

  /**
   * Returns {@code value} without a trailing {@code .0} when it is a whole number, so {@code 5d} formats as
   * {@code "5"} and {@code 0.5} as {@code "0.5"}.
   */
  public static String formatNumber(double value) {
    if (value % 1 == 0 && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  /**
   * Returns {@code value} as the narrowest java number that represents it exactly: an {@link Integer} for whole
   * numbers in int range, otherwise a {@link Double}.
   */
  public static Number narrowNumber(double value) {
    if (value % 1 == 0 && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE &&
      !(value == 0 && 1 / value < 0)) {
      return (int) value;
    }
    return value;
  }
}
