package io.jsontable.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Safety bounds for a conversion.
 *
 * @param defaultCap rows kept when the caller gives no explicit limit and the data is larger
 * @param maxObjects records scanned when collecting column names
 * @param maxKeys distinct column names kept
 * @param maxKeyLength longest column name kept, in characters
 */
public record ConversionConfig(int defaultCap, int maxObjects, int maxKeys, int maxKeyLength) {

  public static final int DEFAULT_CAP = 10_000;
  public static final int DEFAULT_MAX_OBJECTS = 10_000;
  public static final int DEFAULT_MAX_KEYS = 1_000;
  public static final int DEFAULT_MAX_KEY_LENGTH = 255;

  public ConversionConfig {
    requirePositive("defaultCap", defaultCap);
    requirePositive("maxObjects", maxObjects);
    requirePositive("maxKeys", maxKeys);
    requirePositive("maxKeyLength", maxKeyLength);
  }

  /**
   * Creates the default bounds (10000 rows, 10000 scanned objects, 1000 keys, 255 characters).
   *
   * @return default configuration
   */
  public static ConversionConfig defaults() {
    return new ConversionConfig(
        DEFAULT_CAP, DEFAULT_MAX_OBJECTS, DEFAULT_MAX_KEYS, DEFAULT_MAX_KEY_LENGTH);
  }

  /**
   * Loads bounds from a properties file. Missing keys keep their defaults.
   *
   * @param configPath properties file
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static ConversionConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }

    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }

    return fromProperties(props);
  }

  /**
   * Converts properties to a configuration.
   *
   * @param props properties with optional {@code defaultCap}, {@code maxObjects}, {@code maxKeys}
   *     and {@code maxKeyLength} entries
   * @return configuration
   * @throws IllegalArgumentException if a value is not a positive integer
   */
  public static ConversionConfig fromProperties(Properties props) {
    return new ConversionConfig(
        intProperty(props, "defaultCap", DEFAULT_CAP),
        intProperty(props, "maxObjects", DEFAULT_MAX_OBJECTS),
        intProperty(props, "maxKeys", DEFAULT_MAX_KEYS),
        intProperty(props, "maxKeyLength", DEFAULT_MAX_KEY_LENGTH));
  }

  /**
   * Returns a copy with a different default row cap.
   *
   * @param cap new cap
   * @return new configuration
   */
  public ConversionConfig withDefaultCap(int cap) {
    return new ConversionConfig(cap, maxObjects, maxKeys, maxKeyLength);
  }

  private static int intProperty(Properties props, String key, int fallback) {
    String value = props.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value for '" + key + "': " + value.trim(), e);
    }
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }
}
