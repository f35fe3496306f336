package io.jsontable.core;

/**
 * Base exception for failures while turning JSON data into a table.
 *
 * <p>Conversion failures are structural and deterministic, so callers are expected to present them
 * rather than retry.
 */
public class JsonTableException extends RuntimeException {

  /**
   * Creates exception with message.
   *
   * @param message error message
   */
  public JsonTableException(String message) {
    super(message);
  }

  /**
   * Creates exception with message and cause.
   *
   * @param message error message
   * @param cause underlying cause
   */
  public JsonTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
