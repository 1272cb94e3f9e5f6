package com.onthegomap.styleexpr.dist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.styleexpr.config.Arguments;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StyleExpressionMainTest {

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

  private List<String> output() {
    return bytes.toString(StandardCharsets.UTF_8).lines().toList();
  }

  @Test
  void testEvaluateStep() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"step\", [\"zoom\"], 1, 5, 2, 10, 3]",
      "zoom", "7"
    ), out);

    assertEquals(StyleExpressionMain.OK, result);
    assertEquals(List.of(
      "expression: [\"step\",[\"zoom\"],1,5,2,10,3]",
      "result: 2"
    ), output());
  }

  @Test
  void testMapStops() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"step\", [\"zoom\"], 1, {\"10\": 3, \"5\": 2}]",
      "zoom", "12",
      "stops", "map"
    ), out);

    assertEquals(StyleExpressionMain.OK, result);
    assertEquals(List.of(
      "expression: [\"step\",[\"zoom\"],1,{\"5\":2,\"10\":3}]",
      "result: 3"
    ), output());
  }

  @Test
  void testInterpolateColors() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"interpolate\", [\"linear\"], [\"zoom\"], 0, \"blue\", 10, \"red\"]",
      "zoom", "5"
    ), out);

    assertEquals(StyleExpressionMain.OK, result);
    assertEquals("result: \"rgba(127.5, 0, 127.5, 1)\"", output().get(1));
  }

  @Test
  void testProperties() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"concat\", [\"get\", \"name\"], \" (\", [\"to-string\", [\"get\", \"lanes\"]], \")\"]",
      "properties", "{\"name\": \"Main St\", \"lanes\": 2}"
    ), out);

    assertEquals(StyleExpressionMain.OK, result);
    assertEquals("result: \"Main St (2)\"", output().get(1));
  }

  @Test
  void testInvalidExpression() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"frobnicate\", 1]"
    ), out);

    assertEquals(StyleExpressionMain.INVALID_EXPRESSION, result);
    assertEquals(List.of(), output());
  }

  @Test
  void testEvaluationFailure() {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"get\", \"name\"]"
    ), out);

    assertEquals(StyleExpressionMain.EVALUATION_FAILED, result);
    assertEquals(List.of("expression: [\"get\",\"name\"]"), output());
  }

  @Test
  void testReadFromFile(@TempDir Path tmpDir) throws IOException {
    Path file = tmpDir.resolve("expression.yml");
    Files.writeString(file, """
      - case
      - [has, name]
      - [get, name]
      - unnamed
      """);

    int result = StyleExpressionMain.run(Arguments.of("file", file), out);

    assertEquals(StyleExpressionMain.OK, result);
    assertEquals(List.of(
      "expression: [\"case\",[\"has\",\"name\"],[\"get\",\"name\"],\"unnamed\"]",
      "result: \"unnamed\""
    ), output());
  }

  @Test
  void testMissingInput(@TempDir Path tmpDir) {
    assertEquals(StyleExpressionMain.INVALID_ARGUMENTS, StyleExpressionMain.run(Arguments.of(), out));
    Arguments missingFile = Arguments.of("file", tmpDir.resolve("missing.json"));
    assertEquals(StyleExpressionMain.INVALID_ARGUMENTS, StyleExpressionMain.run(missingFile, out));
    assertEquals(List.of(), output());
  }

  @ParameterizedTest
  @CsvSource({
    "heatmap_density, 2",
    "heatmap_density, -0.5",
    "zoom, abc",
    "stops, nested",
    "properties, '[1, 2]'",
  })
  void testInvalidArguments(String name, String value) {
    int result = StyleExpressionMain.run(Arguments.of(
      "expression", "[\"zoom\"]",
      name, value
    ), out);

    assertEquals(StyleExpressionMain.INVALID_ARGUMENTS, result);
    assertEquals(List.of(), output());
  }
}
