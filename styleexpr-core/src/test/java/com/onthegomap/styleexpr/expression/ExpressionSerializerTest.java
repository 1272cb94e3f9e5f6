package com.onthegomap.styleexpr.expression;

import static com.onthegomap.styleexpr.expression.Expression.*;
import static com.onthegomap.styleexpr.expression.StopTable.stop;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

class ExpressionSerializerTest {

  private static final ExpressionSerializer FLAT = ExpressionSerializer.create();
  private static final ExpressionSerializer MAP = ExpressionSerializer.create(ExpressionSerializer.StopFormat.MAP);

  @Test
  void testConstants() {
    assertEquals("abc", FLAT.serialize(string("abc")));
    assertEquals(1, FLAT.serialize(number(1)));
    assertEquals(1.5, FLAT.serialize(number(1.5)));
    assertEquals(3e10, FLAT.serialize(number(3e10)));
    assertEquals(true, FLAT.serialize(bool(true)));
    assertSame(Color.WHITE, FLAT.serialize(color(Color.WHITE)));
    assertEquals(List.of("literal", List.of(1d, 2d)), FLAT.serialize(constOf(Value.array(List.of(1, 2)))));
    assertEquals(List.of("literal", Map.of("a", "b")), FLAT.serialize(constOf(Value.from(Map.of("a", "b")))));
    var blob = Value.opaque("blob", "xyz");
    assertSame(blob, FLAT.serialize(constOf(blob)));
  }

  @Test
  void testVariables() {
    assertEquals(List.of("zoom"), FLAT.serialize(zoom()));
    assertEquals(List.of("heatmap-density"), FLAT.serialize(heatmapDensity()));
    assertEquals(List.of("var", "x"), FLAT.serialize(variable("x")));
  }

  @Test
  void testStep() {
    var step = ExpressionTranslator.translate(List.of("step", List.of("zoom"), 1, 5, 2, 10, 3));
    assertEquals(List.of("step", List.of("zoom"), 1, 5, 2, 10, 3), FLAT.serialize(step));
    assertEquals(List.of("step", List.of("zoom"), 1, Map.of("5", 2, "10", 3)), MAP.serialize(step));
  }

  @Test
  void testStopMapIsOrdered() {
    var step = step(zoom(), number(0), StopTable.of(stop(-1.5, 1), stop(2, 2), stop(10, 3)));
    var serialized = (List<?>) MAP.serialize(step);
    var stops = (Map<?, ?>) serialized.get(3);
    assertEquals(List.of("-1.5", "2", "10"), List.copyOf(stops.keySet()));
  }

  @Test
  void testInterpolate() {
    assertEquals(
      List.of("interpolate", List.of("cubic-bezier", 0.42, 0, 0.58, 1), List.of("zoom"), 0, "blue", 10, "red"),
      FLAT.serialize(interpolate(CurveType.cubicBezier(0.42, 0, 0.58, 1), zoom(),
        StopTable.of(stop(0, "blue"), stop(10, "red"))))
    );
    assertEquals(
      List.of("interpolate", List.of("exponential", 1.5), List.of("zoom"), 0, 0, 10, 100),
      FLAT.serialize(interpolateFunction("zoom", "exponential", number(1.5), Map.of(0, 0, 10, 100)))
    );
  }

  @Test
  void testCaseAndConcatAreFlattened() {
    assertEquals(
      List.of("case", true, "a", false, "b", "c"),
      FLAT.serialize(ternary(bool(true), string("a"), ternary(bool(false), string("b"), string("c"))))
    );
    assertEquals(
      List.of("concat", "a", "b", List.of("get", "c")),
      FLAT.serialize(string("a").appending("b").appending(call("get", string("c"))))
    );
    assertEquals(
      List.of("concat", "a", List.of("concat", "b", "c")),
      FLAT.serialize(concatenation(string("a"), concatenation(string("b"), string("c"))))
    );
  }

  @TestFactory
  Stream<DynamicTest> testRoundTrip() {
    return Stream.of(
      List.of("step", List.of("zoom"), 1, 5, 2, 10, 3),
      List.of("step", List.of("heatmap-density"), "none", Map.of("0.5", "half", "0.75", List.of("get", "label"))),
      List.of("interpolate", List.of("linear"), List.of("zoom"), 0, "blue", 10, "red"),
      List.of("interpolate", List.of("exponential", 1.2), List.of("zoom"), 5, 1, 10, List.of("*", 2, 4)),
      List.of("interpolate", List.of("cubic-bezier", 0.25, 0.1, 0.25, 1), List.of("get", "rank"), 0, 0, 1.5, 10),
      List.of("interpolate", List.of("linear"), List.of("zoom"), 0, List.of("literal", List.of(0, 0)), 10,
        List.of("literal", List.of(5, 10))),
      List.of("case", List.of("has", "name"), List.of("get", "name"), List.of("==", List.of("get", "kind"), "road"),
        "road", "unknown"),
      List.of("concat", "a", List.of("to-string", List.of("zoom")), "c", List.of("concat", "d", "e")),
      List.of("let", "x", 2, List.of("*", List.of("var", "x"), List.of("var", "x"))),
      List.of("match", List.of("get", "class"), "motorway", "red", "trunk", "orange", "gray"),
      List.of("literal", Map.of("a", List.of(1, 2))),
      List.of("to-color", "red"),
      List.of("rgba", 255, 0, 0, 0.5),
      List.of("step", List.of("zoom"), Color.BLACK, 10, Color.WHITE)
    ).flatMap(input -> Stream.of(FLAT, MAP).map(serializer -> dynamicTest(serializer.stopFormat() + " " + input, () -> {
      Expression expression = ExpressionTranslator.translate(input);
      Object serialized = serializer.serialize(expression);
      assertEquals(expression, ExpressionTranslator.translate(serialized));
      assertEquals(serialized, serializer.serialize(ExpressionTranslator.translate(serialized)));
    })));
  }

  @Test
  void testRoundTripOfBuiltExpressions() {
    for (Expression expression : List.of(
      stepFunction("zoomLevel", Color.BLACK, Map.of(5, "red", 10, Color.WHITE)),
      interpolateFunction("heatmapDensity", "cubic-bezier", constOf(Value.array(List.of(0, 0, 1, 1))),
        Map.of(0, 0, 1, 10)),
      concatenation("abc", string("def")),
      ternary(call("<", zoom(), number(-0.5)), opaque("blob", 1), constOf(Value.array(List.of("zoom")))),
      step(call("get", string("x")), variable("fallback"), StopTable.of(stop(1e12, -3.25))),
      step(zoom(), number(0), StopTable.of(stop(-0.0, 1), stop(1, 2)))
    )) {
      assertEquals(expression, ExpressionTranslator.translate(FLAT.serialize(expression)), expression.toString());
      assertEquals(expression, ExpressionTranslator.translate(MAP.serialize(expression)), expression.toString());
    }
  }
}
