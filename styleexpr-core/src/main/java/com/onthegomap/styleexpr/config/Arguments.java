package com.onthegomap.styleexpr.config;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named settings for the style expression tools, read from the command line, JVM properties, environmental variables,
 * or a properties file.
 * <p>
 * Names are matched ignoring case and the difference between {@code .}, {@code -} and {@code _}, so
 * {@code --heatmap-density}, {@code -Dstyleexpr.heatmap_density} and {@code STYLEEXPR_HEATMAP_DENSITY} all set the
 * same {@code heatmap_density} setting.
 * <p>
 * A renamed setting can still be read under its old name with {@code "new_name|old_name"}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final Pattern SEPARATOR = Pattern.compile("[._-]");
  private static final String JVM_PREFIX = "styleexpr.";
  private static final String ENV_PREFIX = "STYLEEXPR_";

  /** Looks up the raw value for a normalized name, or null. */
  private final UnaryOperator<String> source;
  /** Names already logged, or null to log every read. */
  private final Multiset<String> logged;
  private boolean silent = false;

  private Arguments(UnaryOperator<String> source, Multiset<String> logged) {
    this.source = source;
    this.logged = logged;
  }

  private static String normalize(String name) {
    return SEPARATOR.matcher(name.strip()).replaceAll("_").toLowerCase(Locale.ROOT);
  }

  /** Returns settings from {@code values}, a map from setting name to value. */
  public static Arguments of(Map<String, String> values) {
    Map<String, String> normalized = new HashMap<>();
    values.forEach((name, value) -> normalized.put(normalize(name), value));
    return new Arguments(normalized::get, null);
  }

  /** Returns settings from alternating names and values, {@code of("zoom", 5, "silent", true)}. */
  public static Arguments of(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected names and values in pairs, got " + namesAndValues.length + " items");
    }
    Map<String, String> values = new HashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      values.put(namesAndValues[i].toString(), namesAndValues[i + 1].toString());
    }
    return of(values);
  }

  /**
   * Returns settings from command-line arguments.
   * <p>
   * Accepts {@code name=value}, {@code --name=value}, {@code --name value}, and a bare {@code --name} or {@code name}
   * which sets it to {@code true}. A value may start with a single dash, so {@code --zoom -1} works.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> values = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      String name = (equals < 0 ? arg : arg.substring(0, equals)).replaceFirst("^-+", "");
      if (equals >= 0) {
        values.put(name, arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("--")) {
        values.put(name, args[i++].strip());
      } else {
        values.put(name, "true");
      }
    }
    return of(values);
  }

  /** Returns settings from JVM system properties starting with {@code styleexpr.}, like {@code -Dstyleexpr.zoom=5}. */
  public static Arguments fromJvmProperties() {
    Properties properties = System.getProperties();
    Map<String, String> values = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      values.put(name, properties.getProperty(name));
    }
    return fromJvmProperties(values);
  }

  static Arguments fromJvmProperties(Map<String, String> properties) {
    return withPrefix(properties, JVM_PREFIX);
  }

  /** Returns settings from environmental variables starting with {@code STYLEEXPR_}, like {@code STYLEEXPR_ZOOM=5}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static Arguments fromEnvironment(Map<String, String> environment) {
    return withPrefix(environment, ENV_PREFIX);
  }

  private static Arguments withPrefix(Map<String, String> values, String prefix) {
    Map<String, String> unprefixed = new HashMap<>();
    values.forEach((name, value) -> {
      if (name.length() > prefix.length() && name.regionMatches(true, 0, prefix, 0, prefix.length())) {
        unprefixed.put(name.substring(prefix.length()), value);
      }
    });
    return of(unprefixed);
  }

  /**
   * Returns settings from a java properties file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> values = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      values.put(name, properties.getProperty(name));
    }
    return of(values);
  }

  /**
   * Returns settings from command-line arguments, falling back to JVM properties, then environmental variables, then
   * the properties file named by the {@code config} setting from any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    Path config = arguments.file("config", "path to a properties file with more settings", null);
    return config == null ? arguments : arguments.orElse(fromConfigFile(config));
  }

  /** Returns settings that read from this instance first and {@code fallback} for names this one does not set. */
  public Arguments orElse(Arguments fallback) {
    Arguments result = new Arguments(name -> {
      String value = source.apply(name);
      return value != null ? value : fallback.source.apply(name);
    }, logged);
    result.silent = silent;
    return result;
  }

  /** Returns a copy of these settings that logs the value of each setting the first time it is read only. */
  public Arguments withExactlyOnceLogging() {
    Arguments result = new Arguments(source, HashMultiset.create());
    result.silent = silent;
    return result;
  }

  /** Stops logging setting values as they are read. */
  public Arguments silence() {
    silent = true;
    return this;
  }

  public boolean silenced() {
    return silent;
  }

  private String lookup(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = source.apply(normalize(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Setting '{}' is deprecated, use '{}' instead", names[i].strip(), names[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private void log(String key, String description, Object value) {
    if (silent || (logged != null && logged.add(key, 1) > 0)) {
      return;
    }
    LOGGER.debug("setting: {}={} ({})", key.split("\\|")[0], value, description);
  }

  /** Returns the setting {@code key}, or {@code defaultValue} if it is not set. */
  public String getString(String key, String description, String defaultValue) {
    String value = lookup(key);
    String result = value == null ? defaultValue : value;
    log(key, description, result);
    return result;
  }

  /**
   * Returns the setting {@code key}.
   *
   * @throws IllegalArgumentException if it is not set
   */
  public String getString(String key, String description) {
    String value = lookup(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    log(key, description, value);
    return value;
  }

  /** Returns true if the setting {@code key} is {@code true} in any case, or {@code defaultValue} if it is unset. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    String value = lookup(key);
    boolean result = value == null ? defaultValue : "true".equalsIgnoreCase(value);
    log(key, description, result);
    return result;
  }

  /**
   * Returns the setting {@code key} as a number, or {@code defaultValue} (which may be null) if it is not set.
   *
   * @throws IllegalArgumentException if the value is not a number
   */
  public Double getDouble(String key, String description, Double defaultValue) {
    return getObject(key, description, defaultValue, value -> {
      try {
        return Double.parseDouble(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
      }
    });
  }

  /** Returns the setting {@code key} as a path, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    return getObject(key, description, defaultValue, Path::of);
  }

  /** Returns the setting {@code key} converted by {@code parser}, or {@code defaultValue} if it is not set. */
  public <T> T getObject(String key, String description, T defaultValue, Function<String, T> parser) {
    String value = lookup(key);
    T result = value == null ? defaultValue : parser.apply(value);
    log(key, description, result);
    return result;
  }
}
