package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.util.Format;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable, ordered mapping from numeric keys (zoom level, property value) to the output at that key.
 * <p>
 * Keys are strictly ascending with no duplicates and there is always at least one stop. Every key is normalized to a
 * {@code double} before comparison, so integer {@code 1} and floating-point {@code 1.0} are the same key.
 */
public final class StopTable {
  private static final Logger LOGGER = LoggerFactory.getLogger(StopTable.class);

  private final double[] keys;
  private final List<Stop> stops;

  private StopTable(List<Stop> stops) {
    this.stops = List.copyOf(stops);
    this.keys = new double[stops.size()];
    for (int i = 0; i < keys.length; i++) {
      keys[i] = stops.get(i).key();
    }
  }

  /** A single {@code (key, output)} pair, where a key of {@code -0.0} is stored as {@code 0.0}. */
  public record Stop(double key, Expression output) {
    public Stop {
      if (key == 0) {
        key = 0d;
      }
      if (output == null) {
        throw new ParseException(ParseException.Reason.MALFORMED_EXPRESSION, "Stop " + key + " has no output");
      }
    }
  }

  public static Stop stop(double key, Object output) {
    return new Stop(key, Expression.of(output));
  }

  /**
   * Returns a table from stops in the order given.
   *
   * @throws ParseException with {@link ParseException.Reason#EMPTY_STOPS} if {@code stops} is empty or
   *                        {@link ParseException.Reason#NON_ASCENDING_STOPS} if a key is not strictly greater than the
   *                        one before it
   */
  public static StopTable of(List<Stop> stops) {
    if (stops == null || stops.isEmpty()) {
      throw new ParseException(ParseException.Reason.EMPTY_STOPS, "Stops must contain at least one entry");
    }
    for (int i = 0; i < stops.size(); i++) {
      double key = stops.get(i).key();
      if (Double.isNaN(key) || (i > 0 && !(stops.get(i - 1).key() < key))) {
        throw new ParseException(ParseException.Reason.NON_ASCENDING_STOPS,
          "Stop keys must be strictly ascending, got " + describeKeys(stops));
      }
    }
    return new StopTable(stops);
  }

  public static StopTable of(Stop... stops) {
    return of(List.of(stops));
  }

  /**
   * Returns a table from an unordered map of numeric keys to outputs, sorted by key.
   * <p>
   * Outputs that are not already an {@link Expression} are wrapped in a constant.
   *
   * @throws ParseException with {@link ParseException.Reason#EMPTY_STOPS} if the map is empty or
   *                        {@link ParseException.Reason#NON_ASCENDING_STOPS} if two keys are equal after being
   *                        converted to doubles
   */
  public static StopTable fromMap(Map<? extends Number, ?> stops) {
    if (stops == null || stops.isEmpty()) {
      throw new ParseException(ParseException.Reason.EMPTY_STOPS, "Stops must contain at least one entry");
    }
    List<Stop> sorted = new ArrayList<>(stops.size());
    for (var entry : stops.entrySet()) {
      if (entry.getKey() == null) {
        throw new ParseException(ParseException.Reason.NON_ASCENDING_STOPS, "Stop keys must not be null");
      }
      sorted.add(stop(entry.getKey().doubleValue(), entry.getValue()));
    }
    sorted.sort(Comparator.comparingDouble(Stop::key));
    LOGGER.trace("Sorted stop keys {}", describeKeys(sorted));
    return of(sorted);
  }

  public static Builder builder() {
    return new Builder();
  }

  private static String describeKeys(List<Stop> stops) {
    return stops.stream().map(stop -> Format.formatNumber(stop.key())).collect(Collectors.joining(", ", "[", "]"));
  }

  public int size() {
    return stops.size();
  }

  public Stop get(int index) {
    return stops.get(index);
  }

  public double key(int index) {
    return keys[index];
  }

  public List<Stop> stops() {
    return stops;
  }

  public double firstKey() {
    return keys[0];
  }

  public double lastKey() {
    return keys[keys.length - 1];
  }

  /** Returns the index of the stop with the greatest key {@code <= x}, or -1 if {@code x} is below every key. */
  public int floorIndex(double x) {
    int lo = 0;
    int hi = keys.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (keys[mid] <= x) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo - 1;
  }

  /** Returns the outputs of every stop, in key order. */
  public List<Expression> outputs() {
    return stops.stream().map(Stop::output).toList();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof StopTable other && stops.equals(other.stops));
  }

  @Override
  public int hashCode() {
    return stops.hashCode();
  }

  @Override
  public String toString() {
    return "StopTable" + stops.stream()
      .map(stop -> Format.formatNumber(stop.key()) + "=" + stop.output())
      .collect(Collectors.joining(", ", "{", "}"));
  }

  /** Accumulates stops in ascending key order then validates them in {@link #build()}. */
  public static class Builder {
    private final List<Stop> stops = new ArrayList<>();

    private Builder() {}

    public Builder put(double key, Object output) {
      stops.add(stop(key, output));
      return this;
    }

    public StopTable build() {
      return of(stops);
    }
  }
}
