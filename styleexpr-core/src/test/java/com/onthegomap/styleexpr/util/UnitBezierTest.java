package com.onthegomap.styleexpr.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class UnitBezierTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0",
    "0.25, 0.25",
    "0.5, 0.5",
    "1, 1",
    "-1, 0",
    "2, 1",
  })
  void testLinear(double x, double expected) {
    assertEquals(expected, new UnitBezier(0, 0, 1, 1).solve(x), 1e-6);
  }

  @Test
  void testEaseIsSymmetric() {
    var ease = new UnitBezier(0.42, 0, 0.58, 1);
    assertEquals(0.5, ease.solve(0.5), 1e-6);
    assertEquals(1 - ease.solve(0.2), ease.solve(0.8), 1e-5);
    assertTrue(ease.solve(0.2) < 0.2);
  }

  @Test
  void testMonotonic() {
    var curve = new UnitBezier(0.9, 0.1, 0.1, 0.9);
    double last = curve.solve(0);
    for (int i = 1; i <= 1000; i++) {
      double next = curve.solve(i / 1000d);
      assertTrue(next >= last, "not monotonic at " + i);
      last = next;
    }
  }

  @Test
  void testSteepCurveFallsBackToBisection() {
    var curve = new UnitBezier(1, 0, 0, 1);
    double y = curve.solve(0.5);
    assertEquals(0.5, y, 1e-5);
  }
}
