package com.onthegomap.styleexpr.dist;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.onthegomap.styleexpr.util.Format;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

/**
 * Utility for decoding JSON or YAML text into the generic object graph that expressions are translated from, and
 * encoding object graphs and values back to JSON.
 * <p>
 * JSON is decoded with jackson, YAML with snakeyaml to handle aliases and anchors.
 */
public class ObjectGraphs {

  private ObjectGraphs() {}

  private static final Load snakeYaml = new Load(LoadSettings.builder().build());
  public static final ObjectMapper jackson = new ObjectMapper()
    .registerModule(new SimpleModule("styleexpr")
      .addSerializer(Color.class, new ColorSerializer())
      .addSerializer(Value.class, new ValueSerializer()));

  /** Writes colors the way CSS reads them, {@code "rgba(255, 0, 0, 1)"}. */
  private static class ColorSerializer extends JsonSerializer<Color> {
    @Override
    public void serialize(Color value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
      gen.writeString(value.toString());
    }
  }

  /** Writes the plain java object a value wraps, with whole numbers written without a decimal point. */
  private static class ValueSerializer extends JsonSerializer<Value> {
    @Override
    public void serialize(Value value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
      if (value instanceof Value.NumberVal number) {
        serializers.defaultSerializeValue(Format.narrowNumber(number.value()), gen);
      } else {
        serializers.defaultSerializeValue(value.unwrap(), gen);
      }
    }
  }

  /** Returns the object graph in {@code json} text. */
  public static Object parseJson(String json) {
    try {
      return jackson.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Returns the object graph in {@code yaml} text. */
  public static Object parseYaml(String yaml) {
    return snakeYaml.loadFromString(yaml);
  }

  /**
   * Returns the object graph in {@code text}, decoded as JSON when it looks like a JSON document and as YAML
   * otherwise.
   */
  public static Object parse(String text) {
    String stripped = text.strip();
    return looksLikeJson(stripped) ? parseJson(stripped) : parseYaml(stripped);
  }

  private static boolean looksLikeJson(String text) {
    return !text.isEmpty() && "[{\"".indexOf(text.charAt(0)) >= 0;
  }

  /**
   * Returns the object graph in {@code text} which must be a map, like the feature properties
   * {@code {"name": "Main St", "lanes": 2}}.
   *
   * @throws IllegalArgumentException if {@code text} does not decode to a map
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> parseMap(String text) {
    Object result = parse(text);
    if (!(result instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("Expected a map, got: " + text);
    }
    return (Map<String, Object>) result;
  }

  /** Returns the object graph in {@code file}, decoded as JSON or YAML depending on its extension. */
  public static Object load(Path file) {
    try {
      String text = Files.readString(file);
      String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
      if (name.endsWith(".json")) {
        return parseJson(text);
      } else if (name.endsWith(".yml") || name.endsWith(".yaml")) {
        return parseYaml(text);
      }
      return parse(text);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns {@code object} encoded as compact JSON. */
  public static String toJson(Object object) {
    try {
      return jackson.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to encode " + object + " as JSON", e);
    }
  }
}
