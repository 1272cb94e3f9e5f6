package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a {@link CurveType} over a {@link StopTable}.
 * <p>
 * Inputs at or beyond either end of the table return the first or last stop output unchanged, and inputs exactly at
 * a stop's key return that stop's output unchanged. Between stops, the two bracketing outputs are evaluated and
 * blended: numbers arithmetically, colors channel by channel, strings that parse as CSS colors as colors, and
 * numeric arrays element by element.
 */
public class Interpolation {

  private Interpolation() {}

  /** Returns the output of {@code stops} at {@code x} using {@code curve} between adjacent stops. */
  public static Value evaluate(CurveType curve, StopTable stops, double x, EvaluationContext context) {
    int index = stops.floorIndex(x);
    if (index < 0) {
      return stops.get(0).output().evaluate(context);
    } else if (index >= stops.size() - 1) {
      return stops.get(stops.size() - 1).output().evaluate(context);
    }
    double lower = stops.key(index);
    if (x == lower) {
      return stops.get(index).output().evaluate(context);
    }
    double upper = stops.key(index + 1);
    double t = curve.fraction(x, lower, upper);
    if (t == 0) {
      return stops.get(index).output().evaluate(context);
    } else if (t == 1) {
      return stops.get(index + 1).output().evaluate(context);
    }
    Value from = stops.get(index).output().evaluate(context);
    Value to = stops.get(index + 1).output().evaluate(context);
    return blend(from, to, t);
  }

  /**
   * Returns the value {@code t} of the way from {@code a} to {@code b}.
   *
   * @throws EvaluationException with {@link EvaluationException.Reason#NON_INTERPOLABLE_OUTPUT} if there is no way to
   *                             blend {@code a} and {@code b} and {@code t} is strictly between 0 and 1, or if
   *                             {@code t} is not a finite number
   */
  public static Value blend(Value a, Value b, double t) {
    if (!Double.isFinite(t)) {
      throw new EvaluationException(EvaluationException.Reason.NON_INTERPOLABLE_OUTPUT,
        "Cannot interpolate between %s and %s at fraction %s".formatted(a, b, t));
    } else if (t == 0) {
      return a;
    } else if (t == 1) {
      return b;
    }
    if (a instanceof Value.NumberVal na && b instanceof Value.NumberVal nb) {
      return Value.of(na.value() + t * (nb.value() - na.value()));
    }
    Color colorA = asColor(a);
    Color colorB = asColor(b);
    if (colorA != null && colorB != null) {
      return Value.of(colorA.blend(colorB, t));
    }
    if (a instanceof Value.OpaqueVal oa && b instanceof Value.OpaqueVal ob && oa.isNumericArray() &&
      ob.isNumericArray() && oa.type().equals(ob.type())) {
      List<?> from = (List<?>) oa.payload();
      List<?> to = (List<?>) ob.payload();
      if (from.size() == to.size()) {
        List<Double> result = new ArrayList<>(from.size());
        for (int i = 0; i < from.size(); i++) {
          double start = (Double) from.get(i);
          double end = (Double) to.get(i);
          result.add(start + t * (end - start));
        }
        return Value.opaque(oa.type(), result);
      }
    }
    throw new EvaluationException(EvaluationException.Reason.NON_INTERPOLABLE_OUTPUT,
      "Cannot interpolate between %s and %s".formatted(a, b));
  }

  private static Color asColor(Value value) {
    if (value instanceof Value.ColorVal color) {
      return color.value();
    } else if (value instanceof Value.StringVal string) {
      return Color.parse(string.value());
    }
    return null;
  }
}
