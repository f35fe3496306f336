package io.jsontable.core.convert;

import io.jsontable.core.InvalidShapeException;
import java.util.List;
import java.util.Map;

/**
 * How the elements of a top-level array are laid out as rows. Chosen once, from the first element,
 * and kept for every element after it.
 */
public enum ArrayMode {
  /** Elements are objects; columns come from their keys. */
  OBJECT_ROWS,
  /** Elements are arrays; each one is a row as-is. */
  RAW_ROWS,
  /** Elements are scalars; each one is a single-cell row. */
  SCALAR_ROWS;

  /**
   * Picks the mode for an array whose first element is {@code first}.
   *
   * @param first first element of the array
   * @return layout for the whole array
   * @throws InvalidShapeException if {@code first} is null
   */
  public static ArrayMode of(Object first) {
    if (first == null) {
      throw InvalidShapeException.nullFirstElement();
    }
    if (first instanceof Map<?, ?>) {
      return OBJECT_ROWS;
    }
    if (first instanceof List<?>) {
      return RAW_ROWS;
    }
    return SCALAR_ROWS;
  }
}
