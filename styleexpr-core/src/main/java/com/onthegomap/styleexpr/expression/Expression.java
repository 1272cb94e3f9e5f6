package com.onthegomap.styleexpr.expression;

import com.onthegomap.styleexpr.expression.stdlib.BuiltInFunction;
import com.onthegomap.styleexpr.expression.stdlib.StyleStdLib;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable expression tree that computes a style attribute value from an {@link EvaluationContext}.
 * <p>
 * Trees are built once by the static factory methods on this interface or by {@link ExpressionTranslator}, which
 * validate every invariant up front and throw {@link ParseException} instead of returning a partially-built tree.
 * After construction a tree can be shared and evaluated concurrently from any number of threads.
 */
public sealed interface Expression permits Expression.Constant, Expression.Variable, Expression.FunctionCall,
  Expression.Step, Expression.Interpolate, Expression.Conditional, Expression.Concatenation {

  /**
   * Evaluates this expression against {@code context}.
   *
   * @throws EvaluationException if an operand has the wrong type or a variable is not bound
   */
  Value evaluate(EvaluationContext context);

  /** Returns the operator name that heads this expression in serialized form. */
  String operator();

  /* Constants */

  static Constant constOf(Value value) {
    return new Constant(value);
  }

  static Constant string(String value) {
    return constOf(Value.of(value));
  }

  static Constant number(double value) {
    return constOf(Value.of(value));
  }

  static Constant bool(boolean value) {
    return constOf(Value.of(value));
  }

  static Constant color(Color value) {
    return constOf(Value.of(value));
  }

  /** Returns a constant holding a value this library passes through without interpreting. */
  static Constant opaque(String type, Object payload) {
    return constOf(Value.opaque(type, payload));
  }

  /**
   * Returns {@code object} if it is already an expression, otherwise a constant wrapping it.
   *
   * @throws ParseException if {@code object} is null
   */
  static Expression of(Object object) {
    if (object instanceof Expression expression) {
      return expression;
    } else if (object == null) {
      throw new ParseException(ParseException.Reason.MALFORMED_EXPRESSION, "Expected a value or expression, got null");
    }
    return constOf(Value.from(object));
  }

  /* Variables and function calls */

  static Variable variable(String name) {
    return new Variable(name);
  }

  static Variable zoom() {
    return variable(EvaluationContext.ZOOM);
  }

  static Variable heatmapDensity() {
    return variable(EvaluationContext.HEATMAP_DENSITY);
  }

  /**
   * Returns an expression that calls the built-in function {@code operator} with {@code args}.
   *
   * @throws ParseException with {@link ParseException.Reason#UNSUPPORTED_OPERATOR} if there is no such function or
   *                        {@link ParseException.Reason#MALFORMED_EXPRESSION} if the arguments are not valid for it
   */
  static FunctionCall call(String operator, List<? extends Expression> args) {
    return new FunctionCall(operator, List.copyOf(args));
  }

  static FunctionCall call(String operator, Expression... args) {
    return call(operator, List.of(args));
  }

  /* Step functions */

  /**
   * Returns a step function over the style function {@code operator} ({@code "zoom"} or {@code "heatmap-density"})
   * that returns {@code defaultValueOrExpr} below the first stop.
   *
   * @param operator           the style function providing the input
   * @param defaultValueOrExpr a {@link Value}, {@link Color}, plain java scalar, or {@link Expression}
   * @param stops              numeric keys mapped to outputs, in any order
   * @throws ParseException with {@link ParseException.Reason#EMPTY_STOPS},
   *                        {@link ParseException.Reason#NON_ASCENDING_STOPS},
   *                        {@link ParseException.Reason#INVALID_DEFAULT_TYPE}, or
   *                        {@link ParseException.Reason#UNSUPPORTED_OPERATOR}
   */
  static Step stepFunction(String operator, Object defaultValueOrExpr, Map<? extends Number, ?> stops) {
    return stepFunction(StyleFunction.from(operator), of(defaultValueOrExpr), StopTable.fromMap(stops));
  }

  static Step stepFunction(StyleFunction operator, Expression defaultOutput, StopTable stops) {
    return step(operator.variable(), defaultOutput, stops);
  }

  /** Returns a step function over an arbitrary numeric {@code input}. */
  static Step step(Expression input, Expression defaultOutput, StopTable stops) {
    return new Step(input, defaultOutput, stops);
  }

  /* Interpolate functions */

  /**
   * Returns an interpolate function over the style function {@code operator} using {@code curveType} between stops.
   *
   * @param operator   the style function providing the input
   * @param curveType  {@code "linear"}, {@code "exponential"}, or {@code "cubic-bezier"}
   * @param parameters curve parameters: null for linear, a number constant for the exponential base, or a constant
   *                   array of the 4 cubic-bezier control point coordinates
   * @param stops      numeric keys mapped to outputs, in any order
   * @throws ParseException with {@link ParseException.Reason#UNKNOWN_CURVE_TYPE},
   *                        {@link ParseException.Reason#INVALID_PARAMETER_COUNT},
   *                        {@link ParseException.Reason#EMPTY_STOPS}, or
   *                        {@link ParseException.Reason#NON_ASCENDING_STOPS}
   */
  static Interpolate interpolateFunction(String operator, String curveType, Expression parameters,
    Map<? extends Number, ?> stops) {
    StyleFunction input = StyleFunction.from(operator);
    CurveType.requireKnown(curveType);
    CurveType curve = CurveType.from(curveType, curveParameters(curveType, parameters));
    return interpolate(curve, input.variable(), StopTable.fromMap(stops));
  }

  static Interpolate interpolateFunction(String operator, String curveType, Map<? extends Number, ?> stops) {
    return interpolateFunction(operator, curveType, null, stops);
  }

  /** Returns an interpolate function over an arbitrary numeric {@code input}. */
  static Interpolate interpolate(CurveType curve, Expression input, StopTable stops) {
    return new Interpolate(curve, input, stops);
  }

  private static List<Double> curveParameters(String curveType, Expression parameters) {
    if (parameters == null) {
      return List.of();
    } else if (parameters instanceof Constant constant) {
      Value value = constant.value();
      if (value instanceof Value.NumberVal number) {
        return List.of(number.value());
      } else if (value instanceof Value.OpaqueVal opaque && opaque.isNumericArray()) {
        List<Double> result = new ArrayList<>();
        for (Object item : (List<?>) opaque.payload()) {
          result.add((Double) item);
        }
        return result;
      }
    }
    throw new ParseException(ParseException.Reason.INVALID_PARAMETER_COUNT, curveType, -1,
      "'%s' curve parameters must be numeric constants, got %s".formatted(curveType, parameters));
  }

  /* Conditionals and concatenation */

  /** Returns an expression that evaluates {@code whenTrue} if {@code condition} is true, else {@code whenFalse}. */
  static Conditional ternary(Expression condition, Expression whenTrue, Expression whenFalse) {
    return new Conditional(condition, whenTrue, whenFalse);
  }

  /** Returns an expression that appends the string {@code appended} evaluates to onto {@code base}. */
  static Concatenation concatenation(Expression base, Expression appended) {
    return new Concatenation(base, appended);
  }

  static Concatenation concatenation(Expression base, String appended) {
    return concatenation(base, string(appended));
  }

  static Concatenation concatenation(String base, Expression appended) {
    return concatenation(string(base), appended);
  }

  /** Returns an expression that appends {@code string} to the result of this expression. */
  default Concatenation appending(String string) {
    return concatenation(this, string);
  }

  /** Returns an expression that appends the string result of {@code expression} to the result of this expression. */
  default Concatenation appending(Expression expression) {
    return concatenation(this, expression);
  }

  private static <T> T require(T value, String operator, int argIndex, String name) {
    if (value == null) {
      throw ParseException.malformed(operator, argIndex, name + " is required");
    }
    return value;
  }

  /** An expression that always returns {@code value}. */
  record Constant(Value value) implements Expression {
    public Constant {
      require(value, Operators.LITERAL, 1, "value");
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return value;
    }

    @Override
    public String operator() {
      return Operators.LITERAL;
    }
  }

  /** An expression that returns the value bound to {@code name} in the evaluation context. */
  record Variable(String name) implements Expression {
    public Variable {
      require(name, Operators.VAR, 1, "name");
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return context.resolve(name);
    }

    @Override
    public String operator() {
      return StyleFunction.isStyleFunction(name) ? name : Operators.VAR;
    }
  }

  /** An expression that calls a built-in function. */
  record FunctionCall(String operatorName, List<Expression> args) implements Expression {
    public FunctionCall {
      BuiltInFunction function = StyleStdLib.get(operatorName);
      if (function == null) {
        throw ParseException.unsupportedOperator(operatorName);
      }
      args = List.copyOf(require(args, operatorName, 1, "args"));
      function.validate(args);
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return StyleStdLib.get(operatorName).apply(args, context);
    }

    @Override
    public String operator() {
      return operatorName;
    }
  }

  /**
   * An expression that returns the output of the stop with the greatest key less than or equal to {@code input}, or
   * {@code defaultOutput} when the input is below the first stop.
   */
  record Step(Expression input, Expression defaultOutput, StopTable stops) implements Expression {
    public Step {
      require(input, Operators.STEP, 1, "input");
      require(defaultOutput, Operators.STEP, 2, "default output");
      require(stops, Operators.STEP, 3, "stops");
      checkDefaultType(defaultOutput, stops);
    }

    private static void checkDefaultType(Expression defaultOutput, StopTable stops) {
      if (defaultOutput instanceof Constant defaultConstant) {
        Value defaultValue = defaultConstant.value();
        for (var stop : stops.stops()) {
          if (stop.output() instanceof Constant stopConstant && !compatible(defaultValue, stopConstant.value())) {
            throw new ParseException(ParseException.Reason.INVALID_DEFAULT_TYPE, Operators.STEP, 2,
              "Default %s is a %s but stop %s outputs a %s".formatted(defaultValue, defaultValue.typeName(),
                stop.key(), stopConstant.value().typeName()));
          }
        }
      }
    }

    private static boolean compatible(Value a, Value b) {
      if (a.getClass() == b.getClass()) {
        return true;
      }
      return (a instanceof Value.ColorVal && b instanceof Value.StringVal s && Color.parse(s.value()) != null) ||
        (b instanceof Value.ColorVal && a instanceof Value.StringVal s2 && Color.parse(s2.value()) != null);
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      double x = numericInput(Operators.STEP, input, context);
      int index = stops.floorIndex(x);
      return index < 0 ? defaultOutput.evaluate(context) : stops.get(index).output().evaluate(context);
    }

    @Override
    public String operator() {
      return Operators.STEP;
    }
  }

  /** An expression that interpolates between stop outputs along {@code curve} for a numeric {@code input}. */
  record Interpolate(CurveType curve, Expression input, StopTable stops) implements Expression {
    public Interpolate {
      require(curve, Operators.INTERPOLATE, 1, "curve");
      require(input, Operators.INTERPOLATE, 2, "input");
      require(stops, Operators.INTERPOLATE, 3, "stops");
    }

    /**
     * Returns the curve's numeric parameters as a constant expression: empty for linear, the base for exponential,
     * and an array of control point coordinates for cubic-bezier.
     */
    public Optional<Expression> parameters() {
      List<Double> parameters = curve.parameters();
      return switch (parameters.size()) {
        case 0 -> Optional.empty();
        case 1 -> Optional.of(number(parameters.get(0)));
        default -> Optional.of(constOf(Value.array(parameters)));
      };
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return Interpolation.evaluate(curve, stops, numericInput(Operators.INTERPOLATE, input, context), context);
    }

    @Override
    public String operator() {
      return Operators.INTERPOLATE;
    }
  }

  private static double numericInput(String operator, Expression input, EvaluationContext context) {
    Value value = input.evaluate(context);
    if (value instanceof Value.NumberVal number) {
      return number.value();
    }
    throw new EvaluationException(EvaluationException.Reason.TYPE_MISMATCH, operator,
      "'%s' input must be a number, got %s".formatted(operator, value));
  }

  /** An expression that evaluates one of two branches depending on a boolean {@code condition}. */
  record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
    public Conditional {
      require(condition, Operators.CASE, 1, "condition");
      require(whenTrue, Operators.CASE, 2, "true branch");
      require(whenFalse, Operators.CASE, 3, "false branch");
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      Value result = condition.evaluate(context);
      if (result instanceof Value.BooleanVal bool) {
        return bool.value() ? whenTrue.evaluate(context) : whenFalse.evaluate(context);
      }
      throw new EvaluationException(EvaluationException.Reason.NON_BOOLEAN_CONDITION, Operators.CASE,
        "Condition must evaluate to a boolean, got " + result);
    }

    @Override
    public String operator() {
      return Operators.CASE;
    }
  }

  /** An expression that joins the strings that {@code base} and {@code appended} evaluate to. */
  record Concatenation(Expression base, Expression appended) implements Expression {
    public Concatenation {
      require(base, Operators.CONCAT, 1, "base");
      require(appended, Operators.CONCAT, 2, "appended");
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return Value.of(stringOperand(base, context) + stringOperand(appended, context));
    }

    private static String stringOperand(Expression operand, EvaluationContext context) {
      Value value = operand.evaluate(context);
      if (value instanceof Value.StringVal string) {
        return string.value();
      }
      throw new EvaluationException(EvaluationException.Reason.NON_STRING_OPERAND, Operators.CONCAT,
        "Cannot concatenate non-string " + value);
    }

    @Override
    public String operator() {
      return Operators.CONCAT;
    }
  }
}
