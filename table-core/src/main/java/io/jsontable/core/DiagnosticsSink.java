package io.jsontable.core;

/**
 * Receives the user-facing notice produced while resolving the row limit.
 *
 * <p>A conversion emits at most one notice. Implementations may be shared between converters
 * running on different threads and must tolerate concurrent calls.
 */
@FunctionalInterface
public interface DiagnosticsSink {

  /** Severity of a notice. */
  enum Level {
    /** Output was truncated by the safety cap. */
    WARNING,
    /** Informational; no data was dropped. */
    INFO
  }

  /**
   * Delivers one notice.
   *
   * @param level severity
   * @param message human readable text
   */
  void emit(Level level, String message);
}
