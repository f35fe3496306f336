package io.jsontable.core;

/** Thrown when there is nothing to convert: a null value, an empty object or an empty array. */
public class EmptyDataException extends JsonTableException {

  public EmptyDataException(String message) {
    super(message);
  }

  static EmptyDataException noData() {
    return new EmptyDataException("No JSON data to process");
  }
}
