package io.jsontable.shell;

import java.io.PrintStream;

/** Line-oriented destination for rendered tables and error messages. */
@FunctionalInterface
public interface OutputWriter {

  void println(String line);

  static OutputWriter to(PrintStream stream) {
    return stream::println;
  }
}
