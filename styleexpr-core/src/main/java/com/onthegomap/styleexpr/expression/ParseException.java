package com.onthegomap.styleexpr.expression;

/**
 * Exception that occurs at construction-time when building or translating an expression.
 * <p>
 * No partial expression is ever returned when this is thrown.
 */
public class ParseException extends RuntimeException {

  /** Why construction failed. */
  public enum Reason {
    EMPTY_STOPS,
    NON_ASCENDING_STOPS,
    INVALID_DEFAULT_TYPE,
    UNKNOWN_CURVE_TYPE,
    INVALID_PARAMETER_COUNT,
    UNSUPPORTED_OPERATOR,
    MALFORMED_EXPRESSION
  }

  private final Reason reason;
  private final String operator;
  private final int argIndex;

  public ParseException(Reason reason, String operator, int argIndex, String message) {
    super(message);
    this.reason = reason;
    this.operator = operator;
    this.argIndex = argIndex;
  }

  public ParseException(Reason reason, String message) {
    this(reason, null, -1, message);
  }

  public static ParseException unsupportedOperator(String name) {
    return new ParseException(Reason.UNSUPPORTED_OPERATOR, name, 0, "Unsupported operator: " + name);
  }

  public static ParseException malformed(String operator, int argIndex, String message) {
    return new ParseException(Reason.MALFORMED_EXPRESSION, operator, argIndex,
      "Malformed '%s' expression at argument %d: %s".formatted(operator, argIndex, message));
  }

  public Reason reason() {
    return reason;
  }

  /** Returns the operator that failed to build, or null if the failure is not tied to one. */
  public String operator() {
    return operator;
  }

  /** Returns the index within the operator's array where the failure was found, or -1 if unknown. */
  public int argIndex() {
    return argIndex;
  }
}
