package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.util.Format;
import com.onthegomap.styleexpr.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes an {@link Expression} back to the generic object graph that {@link ExpressionTranslator} reads, so that
 * {@code ExpressionTranslator.translate(serializer.serialize(e))} equals {@code e}.
 * <p>
 * Numbers are written as {@link Integer} when they are whole and in int range, otherwise {@link Double}. Opaque arrays
 * and objects are wrapped in {@code ["literal", ...]}, colors and other opaque values are written as-is.
 */
public class ExpressionSerializer {

  /** How step and interpolate functions write their stops. */
  public enum StopFormat {
    /** Alternating keys and outputs after the other arguments: {@code ["step", input, default, 5, 2, 10, 3]}. */
    FLAT,
    /** A single map of numeric-literal keys to outputs: {@code ["step", input, default, {"5": 2, "10": 3}]}. */
    MAP
  }

  private static final ExpressionSerializer FLAT = new ExpressionSerializer(StopFormat.FLAT);
  private static final ExpressionSerializer MAP = new ExpressionSerializer(StopFormat.MAP);

  private final StopFormat stopFormat;

  private ExpressionSerializer(StopFormat stopFormat) {
    this.stopFormat = stopFormat;
  }

  public static ExpressionSerializer create() {
    return FLAT;
  }

  public static ExpressionSerializer create(StopFormat stopFormat) {
    return stopFormat == StopFormat.MAP ? MAP : FLAT;
  }

  /** Returns {@code expression} serialized with flat stops. */
  public static Object toObject(Expression expression) {
    return FLAT.serialize(expression);
  }

  public StopFormat stopFormat() {
    return stopFormat;
  }

  /** Returns the object graph representing {@code expression}. */
  public Object serialize(Expression expression) {
    if (expression instanceof Expression.Constant constant) {
      Value value = constant.value();
      if (value instanceof Value.NumberVal number) {
        return serializeNumber(number.value());
      } else if (!(value instanceof Value.OpaqueVal opaque)) {
        return value.unwrap();
      } else if (!readsBackAsLiteral(opaque)) {
        return opaque;
      }
    }
    String name = expression.operator();
    List<Object> result = new ArrayList<>();
    result.add(name);
    Operators.get(name).writer().write(this, expression, result);
    return Collections.unmodifiableList(result);
  }

  /** Returns true for opaque arrays and objects that {@code ["literal", payload]} translates back into. */
  private static boolean readsBackAsLiteral(Value.OpaqueVal opaque) {
    Object payload = opaque.payload();
    return (payload instanceof List<?> || payload instanceof Map<?, ?>) && Value.from(payload).equals(opaque);
  }

  void serializeStops(StopTable stops, List<Object> out) {
    if (stopFormat == StopFormat.MAP) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (var stop : stops.stops()) {
        map.put(Format.formatNumber(stop.key()), serialize(stop.output()));
      }
      out.add(Collections.unmodifiableMap(map));
    } else {
      for (var stop : stops.stops()) {
        out.add(serializeNumber(stop.key()));
        out.add(serialize(stop.output()));
      }
    }
  }

  static Number serializeNumber(double value) {
    return Format.narrowNumber(value);
  }
}
