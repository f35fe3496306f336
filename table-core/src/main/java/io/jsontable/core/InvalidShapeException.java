package io.jsontable.core;

/**
 * Thrown when the top-level value, or the first element of a top-level array, has a type that no
 * table layout supports.
 */
public class InvalidShapeException extends JsonTableException {

  public InvalidShapeException(String message) {
    super(message);
  }

  public static InvalidShapeException scalarRoot(Object value) {
    return new InvalidShapeException(
        String.format(
            "JSON data must be an array or object, got %s", value.getClass().getSimpleName()));
  }

  public static InvalidShapeException nullFirstElement() {
    return new InvalidShapeException("Invalid array data: null first element");
  }
}
