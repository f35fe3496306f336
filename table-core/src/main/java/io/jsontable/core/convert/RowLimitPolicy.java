package io.jsontable.core.convert;

import io.jsontable.core.DiagnosticsSink.Level;

/**
 * Decides how many rows a conversion keeps.
 *
 * <p>An explicit limit from the caller always wins: {@code 0} lifts every cap, a positive value is
 * used verbatim. Without one, data larger than the default cap is cut to the cap. Exactly one
 * notice accompanies the first and last of these cases and none accompanies the others.
 */
public final class RowLimitPolicy {
  private RowLimitPolicy() {}

  /**
   * Resolved limit plus the notice to deliver, if any.
   *
   * @param limit rows to keep
   * @param level notice severity, {@code null} when there is no notice
   * @param message notice text, {@code null} when there is no notice
   */
  public record Resolution(RowLimit limit, Level level, String message) {

    static Resolution silent(RowLimit limit) {
      return new Resolution(limit, null, null);
    }

    public boolean hasDiagnostic() {
      return message != null;
    }
  }

  /**
   * Resolves the row limit for one conversion.
   *
   * @param estimatedSize number of records in the data (1 for a single object)
   * @param userLimit explicit limit, {@code null} when the caller gave none
   * @param defaultCap cap applied to oversized data without an explicit limit
   * @return resolved limit and optional notice
   * @throws IllegalArgumentException if {@code userLimit} is negative
   */
  public static Resolution resolve(int estimatedSize, Integer userLimit, int defaultCap) {
    if (userLimit != null) {
      if (userLimit < 0) {
        throw new IllegalArgumentException("limit must not be negative, got " + userLimit);
      }
      if (userLimit == 0) {
        return new Resolution(
            RowLimit.unlimited(), Level.INFO, "Unlimited rows requested via limit 0");
      }
      return Resolution.silent(RowLimit.of(userLimit));
    }

    if (estimatedSize > defaultCap) {
      return new Resolution(
          RowLimit.of(defaultCap),
          Level.WARNING,
          String.format(
              "Large dataset detected (%d rows). Showing first %d rows for performance. "
                  + "Use limit 0 to show all rows.",
              estimatedSize, defaultCap));
    }
    return Resolution.silent(RowLimit.unlimited());
  }
}
