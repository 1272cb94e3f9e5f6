package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.util.Parse;
import com.onthegomap.styleexpr.util.Try;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a generic object graph decoded from JSON or YAML into an {@link Expression}.
 * <p>
 * Scalars become constants, and lists headed by an operator name are dispatched through {@link Operators}, for
 * example:
 *
 * <pre>{@code
 * ["step", ["zoom"], 1, 5, 2, 10, 3]
 * ["interpolate", ["exponential", 2], ["zoom"], {"0": "blue", "10": "red"}]
 * ["case", ["has", "name"], ["concat", ["get", "name"], "!"], "unnamed"]
 * }</pre>
 */
public class ExpressionTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionTranslator.class);
  private static final ExpressionTranslator INSTANCE = new ExpressionTranslator();

  private ExpressionTranslator() {}

  /**
   * Returns the expression that {@code object} describes.
   *
   * @throws ParseException if {@code object} is not a valid expression
   */
  public static Expression translate(Object object) {
    Expression result = INSTANCE.translate(object, null, -1);
    LOGGER.debug("Translated {} to {}", object, result);
    return result;
  }

  /** Returns a success with the expression that {@code object} describes, or a failure with the reason it is not. */
  public static Try<Expression> tryTranslate(Object object) {
    return Try.apply(() -> translate(object));
  }

  /**
   * Translates {@code object} that appears at {@code argIndex} of a {@code parent} operator array.
   */
  Expression translate(Object object, String parent, int argIndex) {
    if (object instanceof Expression expression) {
      return expression;
    } else if (object instanceof Value value) {
      return Expression.constOf(value);
    } else if (object instanceof String || object instanceof Number || object instanceof Boolean ||
      object instanceof Color) {
      return Expression.constOf(Value.from(object));
    } else if (object instanceof List<?> list) {
      return translateArray(list, parent, argIndex);
    } else if (object == null) {
      throw ParseException.malformed(parent, argIndex, "expected a value or expression, got null");
    }
    throw ParseException.malformed(parent, argIndex, "unexpected " + object.getClass().getSimpleName() + " " + object +
      ", use [\"" + Operators.LITERAL + "\", ...] for a constant array or object");
  }

  private Expression translateArray(List<?> list, String parent, int argIndex) {
    if (list.isEmpty()) {
      throw ParseException.malformed(parent, argIndex, "expected an operator array, got an empty list");
    }
    if (!(list.get(0) instanceof String name)) {
      throw ParseException.malformed(parent, argIndex, "expected an operator name, got " + list.get(0));
    }
    return Operators.get(name).reader().read(this, list);
  }

  /**
   * Translates the stops of {@code array} that start at {@code from}, either as a single map of numeric-literal keys to
   * outputs or as alternating keys and outputs.
   */
  StopTable translateStops(List<?> array, String operator, int from) {
    if (array.size() == from + 1 && array.get(from) instanceof Map<?, ?> map) {
      return translateStopMap(map, operator, from);
    }
    if ((array.size() - from) % 2 != 0) {
      throw ParseException.malformed(operator, array.size() - 1, "expected stop keys and outputs in pairs");
    }
    List<StopTable.Stop> stops = new ArrayList<>((array.size() - from) / 2);
    for (int i = from; i < array.size(); i += 2) {
      double key = stopKey(array.get(i), operator, i);
      stops.add(new StopTable.Stop(key, translate(array.get(i + 1), operator, i + 1)));
    }
    return StopTable.of(stops);
  }

  private StopTable translateStopMap(Map<?, ?> map, String operator, int argIndex) {
    List<StopTable.Stop> stops = new ArrayList<>(map.size());
    for (var entry : map.entrySet()) {
      double key = stopKey(entry.getKey(), operator, argIndex);
      stops.add(new StopTable.Stop(key, translate(entry.getValue(), operator, argIndex)));
    }
    stops.sort(Comparator.comparingDouble(StopTable.Stop::key));
    LOGGER.trace("Sorted {} stop map keys {}", operator, map.keySet());
    return StopTable.of(stops);
  }

  private static double stopKey(Object key, String operator, int argIndex) {
    Double result = Parse.parseDoubleOrNull(key);
    if (result == null || result.isNaN()) {
      throw ParseException.malformed(operator, argIndex, "stop key must be a number, got " + key);
    }
    return result;
  }
}
