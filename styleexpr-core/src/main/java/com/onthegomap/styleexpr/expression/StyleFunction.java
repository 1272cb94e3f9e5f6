package com.onthegomap.styleexpr.expression;

import java.util.List;
import java.util.stream.Stream;

/**
 * Context variables that a step or interpolate function can take as its input.
 */
public enum StyleFunction {
  ZOOM_LEVEL(EvaluationContext.ZOOM, "zoomLevel"),
  HEATMAP_DENSITY(EvaluationContext.HEATMAP_DENSITY, "heatmapDensity");

  private final String id;
  private final List<String> aliases;

  StyleFunction(String id, String... aliases) {
    this.id = id;
    this.aliases = List.of(aliases);
  }

  /** Returns the variable name this function reads, as it appears in serialized expressions. */
  public String id() {
    return id;
  }

  public Expression.Variable variable() {
    return Expression.variable(id);
  }

  /**
   * Returns the style function for {@code name}, accepting either the serialized id ({@code "zoom"}) or the camel-case
   * alias ({@code "zoomLevel"}), with an optional leading {@code $}.
   *
   * @throws ParseException with {@link ParseException.Reason#UNSUPPORTED_OPERATOR} if {@code name} is not a style
   *                        function
   */
  public static StyleFunction from(String name) {
    String normalized = name == null ? null : name.replaceFirst("^\\$", "");
    for (var value : values()) {
      if (value.id.equals(normalized) || value.aliases.contains(normalized)) {
        return value;
      }
    }
    throw new ParseException(ParseException.Reason.UNSUPPORTED_OPERATOR, name, 0,
      "Unsupported style function '" + name + "', expected one of " + Stream.of(values()).map(v -> v.id).toList());
  }

  /** Returns true if {@code name} is the id of a style function. */
  public static boolean isStyleFunction(String name) {
    return Stream.of(values()).anyMatch(v -> v.id.equals(name));
  }
}
