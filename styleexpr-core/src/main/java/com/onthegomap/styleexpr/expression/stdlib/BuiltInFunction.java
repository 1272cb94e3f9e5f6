package com.onthegomap.styleexpr.expression.stdlib;

import com.onthegomap.styleexpr.expression.EvaluationContext;
import com.onthegomap.styleexpr.expression.Expression;
import com.onthegomap.styleexpr.expression.ParseException;
import com.onthegomap.styleexpr.value.Value;
import java.util.List;

/**
 * Groups together a built-in function's name, the number of arguments it accepts, and its implementation.
 *
 * @param name           operator name that invokes this function
 * @param minArgs        minimum number of arguments
 * @param maxArgs        maximum number of arguments, or {@link #VARARGS} for no limit
 * @param argumentCheck  extra construction-time validation of the argument expressions
 * @param implementation evaluates the function against unevaluated arguments
 */
public record BuiltInFunction(
  String name,
  int minArgs,
  int maxArgs,
  ArgumentCheck argumentCheck,
  Implementation implementation
) {

  public static final int VARARGS = Integer.MAX_VALUE;

  BuiltInFunction(String name, int minArgs, int maxArgs, Implementation implementation) {
    this(name, minArgs, maxArgs, args -> {
    }, implementation);
  }

  /**
   * Verifies that {@code args} is a valid argument list for this function.
   *
   * @throws ParseException with {@link ParseException.Reason#MALFORMED_EXPRESSION} if not
   */
  public void validate(List<Expression> args) {
    if (args.size() < minArgs) {
      throw ParseException.malformed(name, args.size() + 1,
        "expected at least %d arguments but got %d".formatted(minArgs, args.size()));
    } else if (args.size() > maxArgs) {
      throw ParseException.malformed(name, maxArgs + 1,
        "expected at most %d arguments but got %d".formatted(maxArgs, args.size()));
    }
    argumentCheck.validate(args);
  }

  /** Evaluates this function with {@code args} against {@code context}. */
  public Value apply(List<Expression> args, EvaluationContext context) {
    return implementation.apply(new CallArguments(name, args, context));
  }

  @FunctionalInterface
  public interface Implementation {
    Value apply(CallArguments args);
  }

  @FunctionalInterface
  public interface ArgumentCheck {
    void validate(List<Expression> args);
  }
}
