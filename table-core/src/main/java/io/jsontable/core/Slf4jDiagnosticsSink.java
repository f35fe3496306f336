package io.jsontable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink; forwards notices to SLF4J. */
public final class Slf4jDiagnosticsSink implements DiagnosticsSink {
  private static final Logger log = LoggerFactory.getLogger(Slf4jDiagnosticsSink.class);

  @Override
  public void emit(Level level, String message) {
    switch (level) {
      case WARNING -> log.warn(message);
      case INFO -> log.info(message);
    }
  }
}
