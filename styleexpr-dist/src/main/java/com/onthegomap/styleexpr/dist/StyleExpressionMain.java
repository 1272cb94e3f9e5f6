package com.onthegomap.styleexpr.dist;

import com.onthegomap.styleexpr.config.Arguments;
import com.onthegomap.styleexpr.expression.EvaluationContext;
import com.onthegomap.styleexpr.expression.EvaluationException;
import com.onthegomap.styleexpr.expression.Expression;
import com.onthegomap.styleexpr.expression.ExpressionSerializer;
import com.onthegomap.styleexpr.expression.ExpressionTranslator;
import com.onthegomap.styleexpr.expression.ParseException;
import com.onthegomap.styleexpr.value.Value;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main driver that translates a style expression given as JSON or YAML text, evaluates it, and prints the result along
 * with the expression re-serialized from the parsed tree.
 * <p>
 * For example:
 *
 * <pre>{@code
 * java -jar styleexpr-dist.jar 'expression=["interpolate", ["linear"], ["zoom"], 0, "blue", 10, "red"]' zoom=5
 * }</pre>
 */
public class StyleExpressionMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(StyleExpressionMain.class);

  static final int OK = 0;
  static final int INVALID_EXPRESSION = 1;
  static final int EVALUATION_FAILED = 2;
  static final int INVALID_ARGUMENTS = 3;

  private StyleExpressionMain() {}

  /*
   * Main entrypoint
   */
  public static void main(String... args) {
    System.exit(run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging(), System.out));
  }

  /** Runs the tool with {@code arguments}, printing results to {@code out} and returning the process exit code. */
  static int run(Arguments arguments, PrintStream out) {
    if (arguments.getBoolean("silent", "don't log argument values", false)) {
      arguments.silence();
    }
    Object input;
    EvaluationContext context;
    ExpressionSerializer serializer;
    try {
      input = readInput(arguments);
      context = readContext(arguments);
      var stopFormat = arguments.getObject("stops", "how to write stops back out: flat or map",
        ExpressionSerializer.StopFormat.FLAT, s -> ExpressionSerializer.StopFormat.valueOf(s.toUpperCase(Locale.ROOT)));
      serializer = ExpressionSerializer.create(stopFormat);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid arguments: {}", e.getMessage());
      return INVALID_ARGUMENTS;
    }

    Expression expression;
    try {
      expression = ExpressionTranslator.translate(input);
    } catch (ParseException e) {
      LOGGER.error("Invalid expression {}: {} ({} at argument {})", ObjectGraphs.toJson(input), e.getMessage(),
        e.reason(), e.argIndex());
      return INVALID_EXPRESSION;
    }
    out.println("expression: " + ObjectGraphs.toJson(serializer.serialize(expression)));

    try {
      Value result = expression.evaluate(context);
      out.println("result: " + ObjectGraphs.toJson(result));
      return OK;
    } catch (EvaluationException e) {
      LOGGER.warn("Unable to evaluate {} ({}): {}", ObjectGraphs.toJson(input), e.reason(), e.getMessage());
      return EVALUATION_FAILED;
    }
  }

  private static EvaluationContext readContext(Arguments arguments) {
    Double zoom = arguments.getDouble("zoom", "zoom level to evaluate at", null);
    Double density = arguments.getDouble("heatmap_density", "heatmap density to evaluate at, between 0 and 1", null);
    Map<String, Object> properties = arguments.getObject("properties",
      "feature properties as a JSON or YAML map", Map.of(), ObjectGraphs::parseMap);
    LOGGER.info("Evaluating with zoom={} heatmap_density={} properties={}", zoom, density, properties);
    EvaluationContext context = EvaluationContext.of(Map.of(), properties);
    if (zoom != null) {
      context = context.withZoom(zoom);
    }
    if (density != null) {
      context = context.withHeatmapDensity(density);
    }
    return context;
  }

  private static Object readInput(Arguments arguments) {
    String inline = arguments.getString("expression", "expression as JSON or YAML text", null);
    if (inline != null) {
      return ObjectGraphs.parse(inline);
    }
    Path file = arguments.file("file", "JSON or YAML file containing the expression", null);
    if (file == null) {
      throw new IllegalArgumentException("Missing required parameter: expression or file");
    }
    if (!Files.exists(file)) {
      throw new IllegalArgumentException(file + " does not exist");
    }
    LOGGER.info("Reading expression from {}", file);
    return ObjectGraphs.load(file);
  }
}
