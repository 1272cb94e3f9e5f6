package com.onthegomap.styleexpr.expression.stdlib;

import com.onthegomap.styleexpr.expression.EvaluationContext;
import com.onthegomap.styleexpr.expression.EvaluationException;
import com.onthegomap.styleexpr.expression.Expression;
import com.onthegomap.styleexpr.value.Color;
import com.onthegomap.styleexpr.value.Value;
import java.util.List;

/**
 * The unevaluated arguments of a function call and the context to evaluate them in.
 * <p>
 * Arguments are only evaluated when a function asks for them, so functions like {@code all} and {@code any} can
 * short-circuit.
 */
public final class CallArguments {
  private final String name;
  private final List<Expression> args;
  private final EvaluationContext context;

  CallArguments(String name, List<Expression> args, EvaluationContext context) {
    this.name = name;
    this.args = args;
    this.context = context;
  }

  public int size() {
    return args.size();
  }

  public EvaluationContext context() {
    return context;
  }

  public Expression expression(int index) {
    return args.get(index);
  }

  /** Evaluates argument {@code index}. */
  public Value value(int index) {
    return args.get(index).evaluate(context);
  }

  public double number(int index) {
    Value value = value(index);
    if (value instanceof Value.NumberVal number) {
      return number.value();
    }
    throw typeMismatch(index, "number", value);
  }

  public String string(int index) {
    Value value = value(index);
    if (value instanceof Value.StringVal string) {
      return string.value();
    }
    throw typeMismatch(index, "string", value);
  }

  public boolean bool(int index) {
    Value value = value(index);
    if (value instanceof Value.BooleanVal bool) {
      return bool.value();
    }
    throw typeMismatch(index, "boolean", value);
  }

  public Color color(int index) {
    Value value = value(index);
    if (value instanceof Value.ColorVal color) {
      return color.value();
    } else if (value instanceof Value.StringVal string) {
      Color parsed = Color.parse(string.value());
      if (parsed != null) {
        return parsed;
      }
    }
    throw typeMismatch(index, "color", value);
  }

  EvaluationException typeMismatch(int index, String expected, Value actual) {
    return new EvaluationException(EvaluationException.Reason.TYPE_MISMATCH, name,
      "'%s' expected argument %d to be a %s but got %s".formatted(name, index + 1, expected, actual));
  }

  EvaluationException error(String message) {
    return new EvaluationException(EvaluationException.Reason.TYPE_MISMATCH, name, "'" + name + "' " + message);
  }
}
