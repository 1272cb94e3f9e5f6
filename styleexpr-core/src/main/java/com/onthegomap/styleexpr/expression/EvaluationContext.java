package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.value.Value;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The runtime environment an expression is evaluated against: named variables like the current zoom level and heatmap
 * density, and the properties of the feature being styled.
 * <p>
 * Contexts are immutable, {@code with*} methods return a copy with the new binding added.
 */
public interface EvaluationContext {

  String ZOOM = "zoom";
  String HEATMAP_DENSITY = "heatmap-density";

  EvaluationContext EMPTY = new MapContext(Map.of(), Map.of());

  static EvaluationContext empty() {
    return EMPTY;
  }

  /**
   * Returns a context with {@code variables} and feature {@code properties}, converting plain java values with
   * {@link Value#from(Object)} and dropping null values.
   */
  static EvaluationContext of(Map<String, ?> variables, Map<String, ?> properties) {
    return new MapContext(toValues(variables), toValues(properties));
  }

  private static Map<String, Value> toValues(Map<String, ?> map) {
    Map<String, Value> result = new LinkedHashMap<>();
    if (map != null) {
      for (var entry : map.entrySet()) {
        if (entry.getValue() != null) {
          result.put(entry.getKey(), Value.from(entry.getValue()));
        }
      }
    }
    return Collections.unmodifiableMap(result);
  }

  /** Returns the value bound to variable {@code name}, or null if it is not bound. */
  Value variable(String name);

  /** Returns the value of feature property {@code key}, or null if the feature does not have it. */
  Value property(String key);

  /**
   * Returns the variable called {@code name}, falling back to a feature property with that name.
   *
   * @throws EvaluationException with {@link EvaluationException.Reason#UNBOUND_VARIABLE} if neither exist
   */
  default Value resolve(String name) {
    Value result = variable(name);
    if (result == null) {
      result = property(name);
    }
    if (result == null) {
      throw EvaluationException.unbound(name);
    }
    return result;
  }

  /** Returns a copy of this context where {@code name} is bound to {@code value}. */
  EvaluationContext withVariable(String name, Value value);

  /** Returns a copy of this context with feature {@code properties} replacing any existing ones. */
  EvaluationContext withProperties(Map<String, ?> properties);

  default EvaluationContext withZoom(double zoom) {
    return withVariable(ZOOM, Value.of(zoom));
  }

  /**
   * Returns a copy of this context with heatmap density set to {@code density}.
   *
   * @throws IllegalArgumentException if {@code density} is not between 0 and 1
   */
  default EvaluationContext withHeatmapDensity(double density) {
    if (!(density >= 0 && density <= 1)) {
      throw new IllegalArgumentException("heatmap density must be between 0 and 1, got " + density);
    }
    return withVariable(HEATMAP_DENSITY, Value.of(density));
  }

  /** A context backed by immutable maps of variables and feature properties. */
  record MapContext(Map<String, Value> variables, Map<String, Value> properties) implements EvaluationContext {

    public MapContext {
      variables = Map.copyOf(variables);
      properties = Map.copyOf(properties);
    }

    @Override
    public Value variable(String name) {
      return variables.get(name);
    }

    @Override
    public Value property(String key) {
      return properties.get(key);
    }

    @Override
    public EvaluationContext withVariable(String name, Value value) {
      Map<String, Value> updated = new LinkedHashMap<>(variables);
      updated.put(name, value);
      return new MapContext(updated, properties);
    }

    @Override
    public EvaluationContext withProperties(Map<String, ?> newProperties) {
      return new MapContext(variables, toValues(newProperties));
    }
  }
}
