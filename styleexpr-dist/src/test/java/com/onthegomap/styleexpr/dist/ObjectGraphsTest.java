package com.onthegomap.styleexpr.dist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ObjectGraphsTest {

  @Test
  void testParseJson() {
    assertEquals(List.of("step", List.of("zoom"), 1, 5, 2.5), ObjectGraphs.parse("[\"step\", [\"zoom\"], 1, 5, 2.5]"));
    assertEquals("blue", ObjectGraphs.parse("\"blue\""));
  }

  @Test
  void testParseYaml() {
    assertEquals(List.of("get", "name"), ObjectGraphs.parse("""
      - get
      - name
      """));
    assertEquals(12, ObjectGraphs.parse("12"));
    assertEquals(true, ObjectGraphs.parse("true"));
  }

  @Test
  void testYamlAnchors() {
    assertEquals(List.of(List.of("zoom"), List.of("zoom")), ObjectGraphs.parseYaml("""
      - &input [zoom]
      - *input
      """));
  }

  @Test
  void testInvalidJson() {
    assertThrows(IllegalArgumentException.class, () -> ObjectGraphs.parseJson("[\"get\""));
  }

  @Test
  void testParseMap() {
    assertEquals(Map.of("name", "Main St", "lanes", 2), ObjectGraphs.parseMap("{\"name\": \"Main St\", \"lanes\": 2}"));
    assertEquals(Map.of("name", "Main St"), ObjectGraphs.parseMap("name: Main St"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"[1, 2]", "1", "plain"})
  void testParseMapRejectsOtherTypes(String text) {
    assertThrows(IllegalArgumentException.class, () -> ObjectGraphs.parseMap(text));
  }

  @Test
  void testLoadByExtension(@TempDir Path tmpDir) throws IOException {
    Path json = tmpDir.resolve("expression.json");
    Files.writeString(json, "[\"get\", \"name\"]");
    Path yaml = tmpDir.resolve("expression.yml");
    Files.writeString(yaml, "[get, name]");

    assertEquals(List.of("get", "name"), ObjectGraphs.load(json));
    assertEquals(List.of("get", "name"), ObjectGraphs.load(yaml));
  }

  @Test
  void testToJson() {
    assertEquals("\"rgba(255, 0, 0, 1)\"", ObjectGraphs.toJson(Color.parse("red")));
    assertEquals("2", ObjectGraphs.toJson(Value.of(2)));
    assertEquals("2.5", ObjectGraphs.toJson(Value.of(2.5)));
    assertEquals("\"a\"", ObjectGraphs.toJson(Value.of("a")));
    assertEquals("\"rgba(0, 0, 255, 1)\"", ObjectGraphs.toJson(Value.of(Color.parse("blue"))));
    assertEquals("[\"step\",[\"zoom\"],1,5,2]", ObjectGraphs.toJson(List.of("step", List.of("zoom"), 1, 5, 2)));
  }
}
