package com.onthegomap.styleexpr.expression;

/**
 * Exception that occurs at runtime when evaluating an {@link Expression} against an {@link EvaluationContext}.
 * <p>
 * The expression is never modified by a failed evaluation, so it can be evaluated again with a different context.
 */
public class EvaluationException extends RuntimeException {

  /** Why evaluation failed. */
  public enum Reason {
    NON_BOOLEAN_CONDITION,
    NON_STRING_OPERAND,
    UNBOUND_VARIABLE,
    NON_INTERPOLABLE_OUTPUT,
    TYPE_MISMATCH
  }

  private final Reason reason;
  private final String name;

  public EvaluationException(Reason reason, String name, String message) {
    super(message);
    this.reason = reason;
    this.name = name;
  }

  public EvaluationException(Reason reason, String message) {
    this(reason, null, message);
  }

  public static EvaluationException unbound(String name) {
    return new EvaluationException(Reason.UNBOUND_VARIABLE, name, "Unbound variable: " + name);
  }

  public Reason reason() {
    return reason;
  }

  /** Returns the variable or operator name involved in the failure, or null if there is none. */
  public String name() {
    return name;
  }
}
