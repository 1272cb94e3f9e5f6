package com.onthegomap.styleexpr.expression.stdlib;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

import com.onthegomap.styleexpr.expression.EvaluationContext;
import com.onthegomap.styleexpr.expression.EvaluationException;
import com.onthegomap.styleexpr.expression.ExpressionTranslator;
import com.onthegomap.styleexpr.expression.ParseException;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class StyleStdLibTest {

  private static final EvaluationContext CONTEXT = EvaluationContext.of(
    Map.of("zoom", 12),
    Map.of("name", "Main St", "lanes", 2, "oneway", true, "tags", List.of("a", "b", "c"))
  );

  private static Value eval(Object expression) {
    return ExpressionTranslator.translate(expression).evaluate(CONTEXT);
  }

  private record Case(Object expression, Object expected) {}

  @TestFactory
  Stream<DynamicTest> testFunctions() {
    return Stream.of(
      // lookup
      new Case(List.of("get", "name"), "Main St"),
      new Case(List.of("has", "name"), true),
      new Case(List.of("has", "missing"), false),
      // bindings
      new Case(List.of("let", "a", 1, "b", 2, List.of("+", List.of("var", "a"), List.of("var", "b"))), 3),
      new Case(List.of("let", "zoom", 3, List.of("var", "zoom")), 3),
      // decision
      new Case(List.of("!", false), true),
      new Case(List.of("==", List.of("get", "lanes"), 2), true),
      new Case(List.of("==", "a", 1), false),
      new Case(List.of("!=", List.of("get", "name"), "Elm St"), true),
      new Case(List.of("<", 1, 2), true),
      new Case(List.of("<=", 2, 2), true),
      new Case(List.of(">", "b", "a"), true),
      new Case(List.of(">=", 1, 2), false),
      new Case(List.of("all", true, List.of("get", "oneway")), true),
      new Case(List.of("all"), true),
      new Case(List.of("all", false, List.of("get", "missing")), false),
      new Case(List.of("any", true, List.of("get", "missing")), true),
      new Case(List.of("any"), false),
      new Case(List.of("match", List.of("get", "lanes"), 1, "one", 2, "two", "many"), "two"),
      new Case(List.of("match", List.of("get", "name"), "Elm St", 1, 0), 0),
      // math
      new Case(List.of("+", 1, 2, 3), 6),
      new Case(List.of("*", 2, 3, 4), 24),
      new Case(List.of("-", 5), -5),
      new Case(List.of("-", 5, 2), 3),
      new Case(List.of("/", 5, 2), 2.5),
      new Case(List.of("%", 5, 2), 1),
      new Case(List.of("^", 2, 10), 1024),
      new Case(List.of("min", 3, 1, 2), 1),
      new Case(List.of("max", 3, 1, 2), 3),
      new Case(List.of("abs", -2), 2),
      new Case(List.of("ceil", 1.2), 2),
      new Case(List.of("floor", 1.8), 1),
      new Case(List.of("round", 2.5), 3),
      new Case(List.of("round", -2.5), -3),
      new Case(List.of("sqrt", 16), 4),
      new Case(List.of("log10", 1000), 3),
      new Case(List.of("log2", 2), 1),
      new Case(List.of("ln", List.of("e")), 1),
      new Case(List.of("pi"), Math.PI),
      // string
      new Case(List.of("upcase", "abc"), "ABC"),
      new Case(List.of("downcase", "ABC"), "abc"),
      new Case(List.of("length", "abc"), 3),
      new Case(List.of("length", List.of("get", "tags")), 3),
      // types
      new Case(List.of("typeof", 1), "number"),
      new Case(List.of("typeof", List.of("get", "tags")), "array"),
      new Case(List.of("to-string", 1), "1"),
      new Case(List.of("to-string", 1.5), "1.5"),
      new Case(List.of("to-string", true), "true"),
      new Case(List.of("to-boolean", 0), false),
      new Case(List.of("to-boolean", "x"), true),
      new Case(List.of("to-boolean", ""), false),
      new Case(List.of("to-number", "1.5"), 1.5),
      new Case(List.of("to-number", "x", true), 1),
      new Case(List.of("to-color", "x", "#ff0000"), Color.parse("red")),
      // color
      new Case(List.of("rgb", 255, 0, 0), Color.parse("red")),
      new Case(List.of("rgba", 0, 0, 255, 0.5), Color.rgba(0, 0, 255, 0.5)),
      new Case(List.of("to-rgba", "red"), List.of(255d, 0d, 0d, 1d))
    ).map(test -> dynamicTest(test.expression.toString(),
      () -> assertEquals(Value.from(test.expected), eval(test.expression))));
  }

  @TestFactory
  Stream<DynamicTest> testTypeMismatches() {
    return Stream.of(
      List.of("!", 1),
      List.of("+", 1, "a"),
      List.of("<", 1, "a"),
      List.of("upcase", 1),
      List.of("length", 1),
      List.of("to-number", "x"),
      List.of("to-color", 1),
      List.of("rgb", 300, 0, 0),
      List.of("to-rgba", "notacolor"),
      List.of("all", 1)
    ).map(expression -> dynamicTest(expression.toString(), () -> {
      var error = assertThrows(EvaluationException.class, () -> eval(expression));
      assertEquals(EvaluationException.Reason.TYPE_MISMATCH, error.reason());
      assertEquals(expression.get(0), error.name());
    }));
  }

  @Test
  void testGetMissingProperty() {
    var error = assertThrows(EvaluationException.class, () -> eval(List.of("get", "missing")));
    assertEquals(EvaluationException.Reason.UNBOUND_VARIABLE, error.reason());
    assertEquals("missing", error.name());
  }

  @Test
  void testRegistry() {
    assertTrue(StyleStdLib.contains("+"));
    assertFalse(StyleStdLib.contains("step"));
    assertFalse(StyleStdLib.contains(null));
    assertNull(StyleStdLib.get("frobnicate"));
    assertEquals(1, StyleStdLib.get("abs").minArgs());
    assertTrue(StyleStdLib.names().contains("to-rgba"));
  }

  static Stream<Arguments> invalidCalls() {
    return Stream.of(
      Arguments.of(List.of("get", 1), "get", 1),
      Arguments.of(List.of("has", true), "has", 1),
      Arguments.of(List.of("let", 1, 2, 3), "let", 1),
      Arguments.of(List.of("let", "a", 1, "b", 2), "let", 4),
      Arguments.of(List.of("match", 1, List.of("get", "a"), 2, 3), "match", 2),
      Arguments.of(List.of("match", 1, 2, 3, 4, 5), "match", 5),
      Arguments.of(List.of("abs"), "abs", 1),
      Arguments.of(List.of("abs", 1, 2), "abs", 2)
    );
  }

  @ParameterizedTest
  @MethodSource("invalidCalls")
  void testInvalidCalls(List<?> expression, String operator, int argIndex) {
    var error = assertThrows(ParseException.class, () -> ExpressionTranslator.translate(expression));
    assertEquals(ParseException.Reason.MALFORMED_EXPRESSION, error.reason());
    assertEquals(operator, error.operator());
    assertEquals(argIndex, error.argIndex());
  }
}
