package com.onthegomap.styleexpr.expression.stdlib;

import static com.onthegomap.styleexpr.expression.stdlib.BuiltInFunction.VARARGS;

import com.onthegomap.styleexpr.expression.EvaluationContext;
import com.onthegomap.styleexpr.expression.EvaluationException;
import com.onthegomap.styleexpr.expression.Expression;
import com.onthegomap.styleexpr.expression.ParseException;
import com.onthegomap.styleexpr.util.Format;
import com.onthegomap.styleexpr.util.Parse;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

/**
 * Built-in functions that a {@link Expression.FunctionCall} can invoke by name.
 */
public class StyleStdLib {

  private static final Map<String, BuiltInFunction> FUNCTIONS = index(List.of(
    // lookup
    new BuiltInFunction("get", 1, 1, requireStringConstant("get"), args -> {
      String key = args.string(0);
      Value result = args.context().property(key);
      if (result == null) {
        throw EvaluationException.unbound(key);
      }
      return result;
    }),
    new BuiltInFunction("has", 1, 1, requireStringConstant("has"),
      args -> Value.of(args.context().property(args.string(0)) != null)),

    // let(name, value, ..., body) -> body evaluated with each name bound to its value
    new BuiltInFunction("let", 3, VARARGS, StyleStdLib::checkLet, args -> {
      EvaluationContext context = args.context();
      for (int i = 0; i < args.size() - 1; i += 2) {
        String name = (String) ((Expression.Constant) args.expression(i)).value().unwrap();
        context = context.withVariable(name, args.expression(i + 1).evaluate(context));
      }
      return args.expression(args.size() - 1).evaluate(context);
    }),

    // decision
    new BuiltInFunction("!", 1, 1, args -> Value.of(!args.bool(0))),
    new BuiltInFunction("==", 2, 2, args -> Value.of(args.value(0).equals(args.value(1)))),
    new BuiltInFunction("!=", 2, 2, args -> Value.of(!args.value(0).equals(args.value(1)))),
    comparison("<", c -> c < 0),
    comparison("<=", c -> c <= 0),
    comparison(">", c -> c > 0),
    comparison(">=", c -> c >= 0),
    new BuiltInFunction("all", 0, VARARGS, args -> {
      for (int i = 0; i < args.size(); i++) {
        if (!args.bool(i)) {
          return Value.FALSE;
        }
      }
      return Value.TRUE;
    }),
    new BuiltInFunction("any", 0, VARARGS, args -> {
      for (int i = 0; i < args.size(); i++) {
        if (args.bool(i)) {
          return Value.TRUE;
        }
      }
      return Value.FALSE;
    }),
    // match(input, label1, output1, label2, output2, ..., fallback)
    new BuiltInFunction("match", 4, VARARGS, StyleStdLib::checkMatch, args -> {
      Value input = args.value(0);
      for (int i = 1; i < args.size() - 1; i += 2) {
        if (input.equals(args.value(i))) {
          return args.value(i + 1);
        }
      }
      return args.value(args.size() - 1);
    }),

    // math
    reduce("+", 2, Double::sum),
    reduce("*", 2, (a, b) -> a * b),
    reduce("min", 1, Math::min),
    reduce("max", 1, Math::max),
    new BuiltInFunction("-", 1, 2,
      args -> Value.of(args.size() == 1 ? -args.number(0) : args.number(0) - args.number(1))),
    binary("/", (a, b) -> a / b),
    binary("%", (a, b) -> a % b),
    binary("^", Math::pow),
    unary("abs", Math::abs),
    unary("ceil", Math::ceil),
    unary("floor", Math::floor),
    unary("round", x -> Math.signum(x) * Math.round(Math.abs(x))),
    unary("sqrt", Math::sqrt),
    unary("ln", Math::log),
    unary("log10", Math::log10),
    unary("log2", x -> Math.log(x) / Math.log(2)),
    new BuiltInFunction("pi", 0, 0, args -> Value.of(Math.PI)),
    new BuiltInFunction("e", 0, 0, args -> Value.of(Math.E)),

    // string
    new BuiltInFunction("upcase", 1, 1, args -> Value.of(args.string(0).toUpperCase(Locale.ROOT))),
    new BuiltInFunction("downcase", 1, 1, args -> Value.of(args.string(0).toLowerCase(Locale.ROOT))),
    new BuiltInFunction("length", 1, 1, args -> {
      Value value = args.value(0);
      if (value instanceof Value.StringVal string) {
        return Value.of(string.value().codePointCount(0, string.value().length()));
      } else if (value instanceof Value.OpaqueVal opaque && opaque.payload() instanceof Collection<?> items) {
        return Value.of(items.size());
      }
      throw args.typeMismatch(0, "string or array", value);
    }),

    // types
    new BuiltInFunction("typeof", 1, 1, args -> Value.of(args.value(0).typeName())),
    new BuiltInFunction("to-string", 1, 1, args -> Value.of(toString(args.value(0)))),
    new BuiltInFunction("to-boolean", 1, 1, args -> Value.of(toBoolean(args.value(0)))),
    new BuiltInFunction("to-number", 1, VARARGS, args -> {
      for (int i = 0; i < args.size(); i++) {
        Value value = args.value(i);
        if (value instanceof Value.NumberVal) {
          return value;
        } else if (value instanceof Value.BooleanVal bool) {
          return Value.of(bool.value() ? 1 : 0);
        } else if (value instanceof Value.StringVal string) {
          Double parsed = Parse.parseDoubleOrNull(string.value());
          if (parsed != null) {
            return Value.of(parsed);
          }
        }
      }
      throw args.error("could not convert any argument to a number");
    }),
    new BuiltInFunction("to-color", 1, VARARGS, args -> {
      for (int i = 0; i < args.size(); i++) {
        Color color = toColor(args.value(i));
        if (color != null) {
          return Value.of(color);
        }
      }
      throw args.error("could not convert any argument to a color");
    }),

    // color
    new BuiltInFunction("rgb", 3, 3, args -> rgba(args, 1)),
    new BuiltInFunction("rgba", 4, 4, args -> rgba(args, args.number(3))),
    new BuiltInFunction("to-rgba", 1, 1, args -> {
      double[] channels = args.color(0).toRgbaArray();
      return Value.array(List.of(channels[0], channels[1], channels[2], channels[3]));
    })
  ));

  private StyleStdLib() {}

  private static Map<String, BuiltInFunction> index(List<BuiltInFunction> functions) {
    Map<String, BuiltInFunction> result = new LinkedHashMap<>();
    for (var function : functions) {
      if (result.put(function.name(), function) != null) {
        throw new IllegalStateException("Duplicate function: " + function.name());
      }
    }
    return Map.copyOf(result);
  }

  /** Returns the function called {@code name}, or null if there is none. */
  public static BuiltInFunction get(String name) {
    return name == null ? null : FUNCTIONS.get(name);
  }

  public static boolean contains(String name) {
    return get(name) != null;
  }

  public static Set<String> names() {
    return FUNCTIONS.keySet();
  }

  private static BuiltInFunction unary(String name, DoubleUnaryOperator fn) {
    return new BuiltInFunction(name, 1, 1, args -> Value.of(fn.applyAsDouble(args.number(0))));
  }

  private static BuiltInFunction binary(String name, DoubleBinaryOperator fn) {
    return new BuiltInFunction(name, 2, 2, args -> Value.of(fn.applyAsDouble(args.number(0), args.number(1))));
  }

  private static BuiltInFunction reduce(String name, int minArgs, DoubleBinaryOperator fn) {
    return new BuiltInFunction(name, minArgs, VARARGS, args -> {
      double result = args.number(0);
      for (int i = 1; i < args.size(); i++) {
        result = fn.applyAsDouble(result, args.number(i));
      }
      return Value.of(result);
    });
  }

  private static BuiltInFunction comparison(String name, DoublePredicate test) {
    return new BuiltInFunction(name, 2, 2, args -> {
      Value a = args.value(0);
      Value b = args.value(1);
      if (a instanceof Value.NumberVal na && b instanceof Value.NumberVal nb) {
        return Value.of(test.test(Double.compare(na.value(), nb.value())));
      } else if (a instanceof Value.StringVal sa && b instanceof Value.StringVal sb) {
        return Value.of(test.test(sa.value().compareTo(sb.value())));
      }
      throw args.error("can only compare two numbers or two strings, got %s and %s".formatted(a, b));
    });
  }

  private static Value rgba(CallArguments args, double alpha) {
    double red = args.number(0);
    double green = args.number(1);
    double blue = args.number(2);
    try {
      return Value.of(Color.rgba(red, green, blue, alpha));
    } catch (IllegalArgumentException e) {
      throw new EvaluationException(EvaluationException.Reason.TYPE_MISMATCH, args.size() == 3 ? "rgb" : "rgba",
        "Invalid color channels [%s, %s, %s, %s]: %s".formatted(red, green, blue, alpha, e.getMessage()));
    }
  }

  static String toString(Value value) {
    if (value instanceof Value.StringVal string) {
      return string.value();
    } else if (value instanceof Value.NumberVal number) {
      return Format.formatNumber(number.value());
    }
    return String.valueOf(value.unwrap());
  }

  static boolean toBoolean(Value value) {
    if (value instanceof Value.BooleanVal bool) {
      return bool.value();
    } else if (value instanceof Value.NumberVal number) {
      return number.value() != 0 && !Double.isNaN(number.value());
    } else if (value instanceof Value.StringVal string) {
      return !string.value().isEmpty();
    }
    return true;
  }

  static Color toColor(Value value) {
    if (value instanceof Value.ColorVal color) {
      return color.value();
    } else if (value instanceof Value.StringVal string) {
      return Color.parse(string.value());
    } else if (value instanceof Value.OpaqueVal opaque && opaque.isNumericArray() &&
      opaque.payload() instanceof List<?> items && (items.size() == 3 || items.size() == 4)) {
      try {
        return Color.rgba((Double) items.get(0), (Double) items.get(1), (Double) items.get(2),
          items.size() == 4 ? (Double) items.get(3) : 1d);
      } catch (IllegalArgumentException e) {
        return null;
      }
    }
    return null;
  }

  private static BuiltInFunction.ArgumentCheck requireStringConstant(String name) {
    return args -> {
      if (args.get(0) instanceof Expression.Constant constant && !(constant.value() instanceof Value.StringVal)) {
        throw ParseException.malformed(name, 1, "property name must be a string, got " + constant);
      }
    };
  }

  private static void checkLet(List<Expression> args) {
    if (args.size() % 2 == 0) {
      throw ParseException.malformed("let", args.size(), "expected name/value pairs followed by a body");
    }
    for (int i = 0; i < args.size() - 1; i += 2) {
      if (!(args.get(i) instanceof Expression.Constant constant && constant.value() instanceof Value.StringVal)) {
        throw ParseException.malformed("let", i + 1, "variable name must be a string literal, got " + args.get(i));
      }
    }
  }

  private static void checkMatch(List<Expression> args) {
    if (args.size() % 2 != 0) {
      throw ParseException.malformed("match", args.size(), "expected label/output pairs followed by a fallback");
    }
    for (int i = 1; i < args.size() - 1; i += 2) {
      if (!(args.get(i) instanceof Expression.Constant constant &&
        (constant.value() instanceof Value.StringVal || constant.value() instanceof Value.NumberVal))) {
        throw ParseException.malformed("match", i + 1, "label must be a string or number literal, got " + args.get(i));
      }
    }
  }
}
