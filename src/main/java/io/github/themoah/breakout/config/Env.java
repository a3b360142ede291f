package io.github.themoah.breakout.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed environment variable lookup with defaults.
 * Missing or blank values yield the default; unparseable values log a warning and yield the default.
 */
public final class Env {

  private static final Logger log = LoggerFactory.getLogger(Env.class);

  private final Function<String, String> lookup;

  public Env(Function<String, String> lookup) {
    this.lookup = lookup;
  }

  public static Env system() {
    return new Env(System::getenv);
  }

  public String getString(String name, String defaultValue) {
    String value = lookup.apply(name);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public int getInt(String name, int defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public long getLong(String name, long defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public double getDouble(String name, double defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  /**
   * Reads a positive integer; zero or negative values fall back to the default.
   */
  public int getPositiveInt(String name, int defaultValue) {
    int value = getInt(name, defaultValue);
    if (value < 1) {
      log.warn("{} must be >= 1, using default: {}", name, defaultValue);
      return defaultValue;
    }
    return value;
  }
}
