package io.jsontable.shell;

import io.jsontable.core.JsonTableException;

/** Thrown when JSON data cannot be located, read or parsed. */
public class JsonLoadException extends JsonTableException {

  public JsonLoadException(String message) {
    super(message);
  }

  public JsonLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
