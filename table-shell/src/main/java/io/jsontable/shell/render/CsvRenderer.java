package io.jsontable.shell.render;

import io.jsontable.core.TableMatrix;
import io.jsontable.shell.OutputWriter;
import java.util.List;

/** CSV renderer for a {@link TableMatrix}. RFC 4180 compliant. */
public final class CsvRenderer {
  private CsvRenderer() {}

  /** Renders every row, header included, padding short rows with empty fields. */
  public static void render(TableMatrix table, OutputWriter out) {
    if (table == null || table.isEmpty()) {
      return;
    }
    int columns = table.width();
    for (List<String> row : table.rows()) {
      out.println(toCsvLine(row, columns));
    }
  }

  static String toCsvLine(List<String> values, int columns) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < columns; i++) {
      if (i > 0) sb.append(',');
      sb.append(escapeCsv(i < values.size() ? values.get(i) : ""));
    }
    return sb.toString();
  }

  /** Quotes a field holding a delimiter, quote or line break; inner quotes are doubled. */
  static String escapeCsv(String field) {
    boolean quoted =
        field.chars().anyMatch(ch -> ch == ',' || ch == '"' || ch == '\n' || ch == '\r');
    return quoted ? '"' + field.replace("\"", "\"\"") + '"' : field;
  }
}
