package com.onthegomap.styleexpr.value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable primitive produced by expression leaves, stop outputs, and evaluation.
 * <p>
 * Values are one of a closed set of variants: {@link StringVal}, {@link NumberVal}, {@link BooleanVal},
 * {@link ColorVal}, or {@link OpaqueVal} for anything else (literal arrays, objects, or platform-specific blobs that
 * this library passes through without interpreting).
 */
public sealed interface Value permits Value.StringVal, Value.NumberVal, Value.BooleanVal, Value.ColorVal,
  Value.OpaqueVal {

  String ARRAY_TYPE = "array";
  String OBJECT_TYPE = "object";

  BooleanVal TRUE = new BooleanVal(true);
  BooleanVal FALSE = new BooleanVal(false);

  static StringVal of(String value) {
    return new StringVal(value);
  }

  static NumberVal of(double value) {
    return new NumberVal(value);
  }

  static BooleanVal of(boolean value) {
    return value ? TRUE : FALSE;
  }

  static ColorVal of(Color value) {
    return new ColorVal(value);
  }

  /** Returns an opaque value tagged with {@code type} that wraps {@code payload}. */
  static OpaqueVal opaque(String type, Object payload) {
    return new OpaqueVal(type, payload);
  }

  /** Returns an opaque {@value #ARRAY_TYPE} value wrapping a copy of {@code items}. */
  static OpaqueVal array(List<?> items) {
    return new OpaqueVal(ARRAY_TYPE, items);
  }

  /**
   * Converts a plain java object to a value.
   * <p>
   * Numbers of any type become a {@link NumberVal}, lists become an opaque array, maps become an opaque object.
   *
   * @throws IllegalArgumentException if {@code object} is null
   */
  static Value from(Object object) {
    if (object instanceof Value value) {
      return value;
    } else if (object instanceof String string) {
      return of(string);
    } else if (object instanceof Number number) {
      return of(number.doubleValue());
    } else if (object instanceof Boolean bool) {
      return of(bool.booleanValue());
    } else if (object instanceof Color color) {
      return of(color);
    } else if (object instanceof Collection<?> list) {
      return opaque(ARRAY_TYPE, list);
    } else if (object instanceof Map<?, ?> map) {
      return opaque(OBJECT_TYPE, map);
    } else if (object == null) {
      throw new IllegalArgumentException("null is not a value");
    }
    return opaque(object.getClass().getSimpleName(), object);
  }

  /** Returns the name of this value's type, as exposed by the {@code typeof} function. */
  String typeName();

  /** Returns the plain java object this value wraps. */
  Object unwrap();

  /** A string value. */
  record StringVal(String value) implements Value {
    public StringVal {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
      return "string";
    }

    @Override
    public String unwrap() {
      return value;
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  /** A numeric value, every number is normalized to a double. */
  record NumberVal(double value) implements Value {

    @Override
    public String typeName() {
      return "number";
    }

    @Override
    public Double unwrap() {
      return value;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /** A boolean value. */
  record BooleanVal(boolean value) implements Value {

    @Override
    public String typeName() {
      return "boolean";
    }

    @Override
    public Boolean unwrap() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /** A color value with exact channel preservation. */
  record ColorVal(Color value) implements Value {
    public ColorVal {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
      return "color";
    }

    @Override
    public Color unwrap() {
      return value;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * A value this library does not interpret, tagged with a type name.
   * <p>
   * List and map payloads are copied into unmodifiable collections with every nested number normalized to a double,
   * so two opaque arrays decoded from different sources compare equal when they hold the same numbers.
   */
  record OpaqueVal(String type, Object payload) implements Value {
    public OpaqueVal {
      Objects.requireNonNull(type, "type");
      payload = normalize(payload);
    }

    private static Object normalize(Object payload) {
      if (payload instanceof Number number) {
        return number.doubleValue();
      } else if (payload instanceof Collection<?> list) {
        List<Object> result = new ArrayList<>(list.size());
        for (Object item : list) {
          result.add(normalize(item));
        }
        return Collections.unmodifiableList(result);
      } else if (payload instanceof Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (var entry : map.entrySet()) {
          result.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
      }
      return payload;
    }

    /** Returns true if this is an array where every item is a number. */
    public boolean isNumericArray() {
      return payload instanceof List<?> list && list.stream().allMatch(Double.class::isInstance);
    }

    @Override
    public String typeName() {
      return type;
    }

    @Override
    public Object unwrap() {
      return payload;
    }
  }
}
