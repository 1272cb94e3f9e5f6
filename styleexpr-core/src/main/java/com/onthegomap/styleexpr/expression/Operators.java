package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.expression.stdlib.StyleStdLib;
import com.onthegomap.styleexpr.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The table of operator names that head expression arrays, mapping each one to how it is read into an
 * {@link Expression} and written back out.
 * <p>
 * {@link ExpressionTranslator} and {@link ExpressionSerializer} both dispatch through this table so that every operator
 * that can be read can also be written in the same shape. Names that are not in the table but are in
 * {@link StyleStdLib} are read and written as {@link Expression.FunctionCall function calls}.
 */
public final class Operators {

  public static final String LITERAL = "literal";
  public static final String VAR = "var";
  public static final String STEP = "step";
  public static final String INTERPOLATE = "interpolate";
  public static final String CASE = "case";
  public static final String CONCAT = "concat";

  /** Reads the arguments of an operator array into an expression. */
  @FunctionalInterface
  interface Reader {
    Expression read(ExpressionTranslator translator, List<?> array);
  }

  /** Writes an expression with this operator back out as an array. */
  @FunctionalInterface
  interface Writer {
    void write(ExpressionSerializer serializer, Expression expression, List<Object> out);
  }

  /** How one operator is read and written. */
  record Operator(String name, Reader reader, Writer writer) {}

  private static final Operator FUNCTION_CALL = new Operator("function call", Operators::readCall,
    (serializer, expression, out) -> {
      for (Expression arg : ((Expression.FunctionCall) expression).args()) {
        out.add(serializer.serialize(arg));
      }
    });

  private static final Map<String, Operator> OPERATORS = index(
    new Operator(LITERAL, Operators::readLiteral, (serializer, expression, out) -> out.add(
      ((Value.OpaqueVal) ((Expression.Constant) expression).value()).payload())),
    new Operator(EvaluationContext.ZOOM, Operators::readStyleFunction, Operators::writeNoArguments),
    new Operator(EvaluationContext.HEATMAP_DENSITY, Operators::readStyleFunction, Operators::writeNoArguments),
    new Operator(VAR, Operators::readVar,
      (serializer, expression, out) -> out.add(((Expression.Variable) expression).name())),
    new Operator(STEP, Operators::readStep, Operators::writeStep),
    new Operator(INTERPOLATE, Operators::readInterpolate, Operators::writeInterpolate),
    new Operator(CASE, Operators::readCase, Operators::writeCase),
    new Operator(CONCAT, Operators::readConcat, Operators::writeConcat)
  );

  private Operators() {}

  private static Map<String, Operator> index(Operator... operators) {
    Map<String, Operator> result = new LinkedHashMap<>();
    for (var operator : operators) {
      if (StyleStdLib.contains(operator.name()) || result.put(operator.name(), operator) != null) {
        throw new IllegalStateException("Duplicate operator: " + operator.name());
      }
    }
    return Map.copyOf(result);
  }

  /** Returns true if {@code name} can head an expression array. */
  public static boolean isOperator(String name) {
    return OPERATORS.containsKey(name) || StyleStdLib.contains(name);
  }

  /**
   * Returns the operator called {@code name}.
   *
   * @throws ParseException with {@link ParseException.Reason#UNSUPPORTED_OPERATOR} if there is none
   */
  static Operator get(String name) {
    Operator operator = OPERATORS.get(name);
    if (operator != null) {
      return operator;
    } else if (StyleStdLib.contains(name)) {
      return FUNCTION_CALL;
    }
    throw ParseException.unsupportedOperator(name);
  }

  private static void requireSize(List<?> array, int min, int max) {
    String name = (String) array.get(0);
    if (array.size() < min) {
      throw ParseException.malformed(name, array.size(), "expected at least %d arguments, got %d"
        .formatted(min - 1, array.size() - 1));
    } else if (array.size() > max) {
      throw ParseException.malformed(name, max, "expected at most %d arguments, got %d"
        .formatted(max - 1, array.size() - 1));
    }
  }

  /* readers */

  private static Expression readCall(ExpressionTranslator translator, List<?> array) {
    String name = (String) array.get(0);
    List<Expression> args = new ArrayList<>(array.size() - 1);
    for (int i = 1; i < array.size(); i++) {
      args.add(translator.translate(array.get(i), name, i));
    }
    return Expression.call(name, args);
  }

  private static Expression readLiteral(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 2, 2);
    Object payload = array.get(1);
    if (payload == null) {
      throw ParseException.malformed(LITERAL, 1, "literal value must not be null");
    }
    return Expression.constOf(Value.from(payload));
  }

  private static Expression readStyleFunction(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 1, 1);
    return StyleFunction.from((String) array.get(0)).variable();
  }

  private static Expression readVar(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 2, 2);
    if (!(array.get(1) instanceof String name)) {
      throw ParseException.malformed(VAR, 1, "variable name must be a string, got " + array.get(1));
    }
    return Expression.variable(name);
  }

  private static Expression readStep(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 4, Integer.MAX_VALUE);
    Expression input = translator.translate(array.get(1), STEP, 1);
    Expression defaultOutput = translator.translate(array.get(2), STEP, 2);
    return Expression.step(input, defaultOutput, translator.translateStops(array, STEP, 3));
  }

  private static Expression readInterpolate(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 4, Integer.MAX_VALUE);
    CurveType curve = readCurve(array.get(1));
    Expression input = translator.translate(array.get(2), INTERPOLATE, 2);
    return Expression.interpolate(curve, input, translator.translateStops(array, INTERPOLATE, 3));
  }

  private static CurveType readCurve(Object curve) {
    if (!(curve instanceof List<?> list) || list.isEmpty() || !(list.get(0) instanceof String name)) {
      throw ParseException.malformed(INTERPOLATE, 1, "expected a curve type like [\"linear\"], got " + curve);
    }
    CurveType.requireKnown(name);
    List<Double> parameters = new ArrayList<>(list.size() - 1);
    for (int i = 1; i < list.size(); i++) {
      if (!(list.get(i) instanceof Number number)) {
        throw new ParseException(ParseException.Reason.INVALID_PARAMETER_COUNT, name, i,
          "'%s' curve parameters must be numbers, got %s".formatted(name, list.get(i)));
      }
      parameters.add(number.doubleValue());
    }
    return CurveType.from(name, parameters);
  }

  private static Expression readCase(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 4, Integer.MAX_VALUE);
    if (array.size() % 2 != 0) {
      throw ParseException.malformed(CASE, array.size() - 1,
        "expected condition/output pairs followed by a fallback");
    }
    Expression result = translator.translate(array.get(array.size() - 1), CASE, array.size() - 1);
    for (int i = array.size() - 3; i >= 1; i -= 2) {
      result = Expression.ternary(
        translator.translate(array.get(i), CASE, i),
        translator.translate(array.get(i + 1), CASE, i + 1),
        result
      );
    }
    return result;
  }

  private static Expression readConcat(ExpressionTranslator translator, List<?> array) {
    requireSize(array, 3, Integer.MAX_VALUE);
    Expression result = translator.translate(array.get(1), CONCAT, 1);
    for (int i = 2; i < array.size(); i++) {
      result = Expression.concatenation(result, translator.translate(array.get(i), CONCAT, i));
    }
    return result;
  }

  /* writers */

  private static void writeNoArguments(ExpressionSerializer serializer, Expression expression, List<Object> out) {
    // the operator name alone identifies the variable
  }

  private static void writeStep(ExpressionSerializer serializer, Expression expression, List<Object> out) {
    var step = (Expression.Step) expression;
    out.add(serializer.serialize(step.input()));
    out.add(serializer.serialize(step.defaultOutput()));
    serializer.serializeStops(step.stops(), out);
  }

  private static void writeInterpolate(ExpressionSerializer serializer, Expression expression, List<Object> out) {
    var interpolate = (Expression.Interpolate) expression;
    List<Object> curve = new ArrayList<>();
    curve.add(interpolate.curve().name());
    for (double parameter : interpolate.curve().parameters()) {
      curve.add(ExpressionSerializer.serializeNumber(parameter));
    }
    out.add(curve);
    out.add(serializer.serialize(interpolate.input()));
    serializer.serializeStops(interpolate.stops(), out);
  }

  private static void writeCase(ExpressionSerializer serializer, Expression expression, List<Object> out) {
    Expression current = expression;
    while (current instanceof Expression.Conditional conditional) {
      out.add(serializer.serialize(conditional.condition()));
      out.add(serializer.serialize(conditional.whenTrue()));
      current = conditional.whenFalse();
    }
    out.add(serializer.serialize(current));
  }

  private static void writeConcat(ExpressionSerializer serializer, Expression expression, List<Object> out) {
    List<Expression> operands = new ArrayList<>();
    Expression current = expression;
    while (current instanceof Expression.Concatenation concatenation) {
      operands.add(0, concatenation.appended());
      current = concatenation.base();
    }
    out.add(serializer.serialize(current));
    for (Expression operand : operands) {
      out.add(serializer.serialize(operand));
    }
  }
}
