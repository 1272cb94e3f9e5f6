package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.util.UnitBezier;
import java.util.List;
import java.util.Objects;

/**
 * The shape of an interpolation curve between two adjacent stops.
 * <p>
 * {@link #fraction(double, double, double)} returns how far between the lower and upper stop an input lies, which
 * is then used to blend the two stop outputs.
 */
public sealed interface CurveType permits CurveType.Linear, CurveType.Exponential, CurveType.CubicBezier {

  String LINEAR = "linear";
  String EXPONENTIAL = "exponential";
  String CUBIC_BEZIER = "cubic-bezier";

  Linear LINEAR_CURVE = new Linear();

  static Linear linear() {
    return LINEAR_CURVE;
  }

  static Exponential exponential(double base) {
    return new Exponential(base);
  }

  static CubicBezier cubicBezier(double x1, double y1, double x2, double y2) {
    return new CubicBezier(x1, y1, x2, y2);
  }

  /**
   * Returns the curve identified by {@code name} with numeric {@code parameters}.
   *
   * @throws ParseException with {@link ParseException.Reason#UNKNOWN_CURVE_TYPE} for an unrecognized name or
   *                        {@link ParseException.Reason#INVALID_PARAMETER_COUNT} when the curve needs a different
   *                        number of parameters
   */
  static CurveType from(String name, List<Double> parameters) {
    requireKnown(name);
    return switch (name) {
      case LINEAR -> {
        checkParameterCount(name, parameters, 0);
        yield linear();
      }
      case EXPONENTIAL -> {
        checkParameterCount(name, parameters, 1);
        yield exponential(parameters.get(0));
      }
      case CUBIC_BEZIER -> {
        checkParameterCount(name, parameters, 4);
        yield cubicBezier(parameters.get(0), parameters.get(1), parameters.get(2), parameters.get(3));
      }
      default -> throw unknown(name);
    };
  }

  /**
   * Verifies that {@code name} identifies a curve, before its parameters are looked at.
   *
   * @throws ParseException with {@link ParseException.Reason#UNKNOWN_CURVE_TYPE} if it does not
   */
  static void requireKnown(String name) {
    if (name == null) {
      throw new ParseException(ParseException.Reason.UNKNOWN_CURVE_TYPE, "Missing curve type");
    } else if (!LINEAR.equals(name) && !EXPONENTIAL.equals(name) && !CUBIC_BEZIER.equals(name)) {
      throw unknown(name);
    }
  }

  private static ParseException unknown(String name) {
    return new ParseException(ParseException.Reason.UNKNOWN_CURVE_TYPE, name, -1,
      "Unknown curve type '" + name + "', expected one of " + List.of(LINEAR, EXPONENTIAL, CUBIC_BEZIER));
  }

  private static ParseException invalidParameter(String name, String message) {
    return new ParseException(ParseException.Reason.INVALID_PARAMETER_COUNT, name, -1, message);
  }

  private static void checkParameterCount(String name, List<Double> parameters, int expected) {
    int actual = parameters == null ? 0 : parameters.size();
    if (actual != expected) {
      throw invalidParameter(name,
        "'%s' curve takes %d numeric parameters but got %d".formatted(name, expected, actual));
    }
    if (parameters != null && parameters.stream().anyMatch(p -> p == null || !Double.isFinite(p))) {
      throw invalidParameter(name, "'%s' curve parameters must be finite numbers: %s".formatted(name, parameters));
    }
  }

  /** Returns the identifier of this curve: {@code linear}, {@code exponential}, or {@code cubic-bezier}. */
  String name();

  /** Returns the numeric parameters of this curve in the order they appear in serialized form. */
  List<Double> parameters();

  /**
   * Returns the interpolation fraction in {@code [0, 1]} for {@code x} between {@code lower} and {@code upper}.
   */
  double fraction(double x, double lower, double upper);

  private static double linearFraction(double x, double lower, double upper) {
    double delta = upper - lower;
    return delta == 0 ? 0 : (x - lower) / delta;
  }

  /** Interpolates proportionally to the distance from each stop. */
  record Linear() implements CurveType {

    @Override
    public String name() {
      return LINEAR;
    }

    @Override
    public List<Double> parameters() {
      return List.of();
    }

    @Override
    public double fraction(double x, double lower, double upper) {
      return linearFraction(x, lower, upper);
    }
  }

  /**
   * Interpolates exponentially, where {@code base} controls how quickly the output increases: values above 1 increase
   * faster towards the upper stop, values between 0 and 1 increase faster near the lower stop, and 1 is linear.
   * <p>
   * The base must be a finite number greater than 0.
   */
  record Exponential(double base) implements CurveType {

    public Exponential {
      if (!(base > 0) || Double.isInfinite(base)) {
        throw invalidParameter(EXPONENTIAL, "'exponential' curve base must be a finite number above 0, got " + base);
      }
    }

    @Override
    public String name() {
      return EXPONENTIAL;
    }

    @Override
    public List<Double> parameters() {
      return List.of(base);
    }

    @Override
    public double fraction(double x, double lower, double upper) {
      double difference = upper - lower;
      if (difference == 0) {
        return 0;
      } else if (base == 1) {
        return linearFraction(x, lower, upper);
      }
      double logBase = Math.log(base);
      double exponent = (x - lower) * logBase;
      double range = difference * logBase;
      if (range > 0) {
        // (b^e - 1) / (b^r - 1) scaled by b^-r so wide stop ranges do not overflow
        return Math.exp(exponent - range) * Math.expm1(-exponent) / Math.expm1(-range);
      }
      return Math.expm1(exponent) / Math.expm1(range);
    }
  }

  /**
   * Interpolates along a cubic Bézier easing curve with control points {@code (x1, y1)} and {@code (x2, y2)}.
   * <p>
   * {@code x1} and {@code x2} must be in {@code [0, 1]} so that the curve is a function of x.
   */
  final class CubicBezier implements CurveType {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;
    private final UnitBezier curve;

    private CubicBezier(double x1, double y1, double x2, double y2) {
      if (!(x1 >= 0 && x1 <= 1 && x2 >= 0 && x2 <= 1)) {
        throw invalidParameter(CUBIC_BEZIER,
          "'cubic-bezier' x1 and x2 must be between 0 and 1, got %s and %s".formatted(x1, x2));
      }
      this.x1 = x1;
      this.y1 = y1;
      this.x2 = x2;
      this.y2 = y2;
      this.curve = new UnitBezier(x1, y1, x2, y2);
    }

    @Override
    public String name() {
      return CUBIC_BEZIER;
    }

    @Override
    public List<Double> parameters() {
      return List.of(x1, y1, x2, y2);
    }

    @Override
    public double fraction(double x, double lower, double upper) {
      return curve.solve(linearFraction(x, lower, upper));
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof CubicBezier other &&
        Double.compare(x1, other.x1) == 0 &&
        Double.compare(y1, other.y1) == 0 &&
        Double.compare(x2, other.x2) == 0 &&
        Double.compare(y2, other.y2) == 0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
      return "CubicBezier[x1=" + x1 + ", y1=" + y1 + ", x2=" + x2 + ", y2=" + y2 + "]";
    }
  }
}
