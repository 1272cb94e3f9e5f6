package com.onthegomap.styleexpr.util;

/**
 * A cubic Bézier easing curve from {@code (0, 0)} to {@code (1, 1)} with two control points, as used by CSS
 * {@code cubic-bezier()} timing functions.
 * <p>
 * {@link #solve(double)} maps linear progress along x to eased progress along y by numerically inverting the x
 * polynomial.
 */
public final class UnitBezier {
  private static final double DEFAULT_EPSILON = 1e-6;
  private static final int NEWTON_ITERATIONS = 8;

  private final double ax;
  private final double bx;
  private final double cx;

  private final double ay;
  private final double by;
  private final double cy;

  public UnitBezier(double x1, double y1, double x2, double y2) {
    // polynomial coefficients, the implicit first and last control points are (0,0) and (1,1)
    cx = 3.0 * x1;
    bx = 3.0 * (x2 - x1) - cx;
    ax = 1.0 - cx - bx;

    cy = 3.0 * y1;
    by = 3.0 * (y2 - y1) - cy;
    ay = 1.0 - cy - by;
  }

  double sampleCurveX(double t) {
    // ax t^3 + bx t^2 + cx t using Horner's rule
    return ((ax * t + bx) * t + cx) * t;
  }

  double sampleCurveY(double t) {
    return ((ay * t + by) * t + cy) * t;
  }

  double sampleCurveDerivativeX(double t) {
    return (3.0 * ax * t + 2.0 * bx) * t + cx;
  }

  /** Returns the curve parameter {@code t} where the x coordinate of the curve is {@code x}. */
  double solveCurveX(double x, double epsilon) {
    if (x <= 0) {
      return 0;
    } else if (x >= 1) {
      return 1;
    }

    // Newton's method converges in a few iterations for well-behaved curves
    double t = x;
    for (int i = 0; i < NEWTON_ITERATIONS; i++) {
      double error = sampleCurveX(t) - x;
      if (Math.abs(error) < epsilon) {
        return t;
      }
      double derivative = sampleCurveDerivativeX(t);
      if (Math.abs(derivative) < 1e-6) {
        break;
      }
      t -= error / derivative;
    }

    // fall back to bisection, x(t) is monotonic on [0, 1] when x1 and x2 are in [0, 1]
    double lo = 0;
    double hi = 1;
    t = x;
    while (lo < hi) {
      double sample = sampleCurveX(t);
      if (Math.abs(sample - x) < epsilon) {
        return t;
      }
      if (x > sample) {
        lo = t;
      } else {
        hi = t;
      }
      double next = (hi - lo) * 0.5 + lo;
      if (next == t) {
        break;
      }
      t = next;
    }
    return t;
  }

  /** Returns the eased y value for linear progress {@code x} in {@code [0, 1]}. */
  public double solve(double x, double epsilon) {
    if (x <= 0) {
      return 0;
    } else if (x >= 1) {
      return 1;
    }
    return sampleCurveY(solveCurveX(x, epsilon));
  }

  public double solve(double x) {
    return solve(x, DEFAULT_EPSILON);
  }
}
