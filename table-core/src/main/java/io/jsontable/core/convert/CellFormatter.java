package io.jsontable.core.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders one JSON value as cell text.
 *
 * <p>{@code null} becomes the empty string, strings are kept verbatim, numbers and booleans use
 * their plain textual form, and nested objects or arrays are written as compact JSON.
 */
public final class CellFormatter {
  private static final Logger log = LoggerFactory.getLogger(CellFormatter.class);

  private static final ObjectMapper MAPPER =
      new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  private CellFormatter() {}

  public static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String str) {
      return str;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
      return value.toString();
    }
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      return toJson(value);
    }
    return String.valueOf(value);
  }

  private static String toJson(Object nested) {
    try {
      return MAPPER.writeValueAsString(nested);
    } catch (JsonProcessingException e) {
      // keys or leaves Jackson cannot write, fall back to the collection's own text
      log.debug("Cannot write nested value as JSON, using toString()", e);
      return String.valueOf(nested);
    }
  }
}
