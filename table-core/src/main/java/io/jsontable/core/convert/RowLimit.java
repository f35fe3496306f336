package io.jsontable.core.convert;

import java.util.List;

/**
 * Maximum number of data rows to materialize.
 *
 * @param cap positive row count, or {@code 0} for no limit
 */
public record RowLimit(int cap) {
  private static final RowLimit UNLIMITED = new RowLimit(0);

  public RowLimit {
    if (cap < 0) {
      throw new IllegalArgumentException("cap must not be negative, got " + cap);
    }
  }

  public static RowLimit unlimited() {
    return UNLIMITED;
  }

  public static RowLimit of(int cap) {
    if (cap <= 0) {
      throw new IllegalArgumentException("cap must be positive, got " + cap);
    }
    return new RowLimit(cap);
  }

  public boolean isUnlimited() {
    return cap == 0;
  }

  /**
   * Returns the leading records allowed by this limit. The input list is returned unchanged when it
   * already fits.
   */
  public <T> List<T> apply(List<T> records) {
    if (isUnlimited() || records.size() <= cap) {
      return records;
    }
    return records.subList(0, cap);
  }
}
