package io.jsontable.shell.render;

import io.jsontable.core.TableMatrix;
import io.jsontable.shell.OutputWriter;
import java.util.ArrayList;
import java.util.List;

/** Box-style text renderer for a {@link TableMatrix}. */
public final class TableRenderer {
  static final int MAX_CELL_WIDTH = 40;
  private static final char ELLIPSIS = '\u2026';

  private TableRenderer() {}

  /** Renders the table, padding short rows to the widest one. */
  public static void render(TableMatrix table, OutputWriter out) {
    if (table == null || table.isEmpty()) {
      out.println("(no rows)");
      return;
    }
    int columns = table.width();
    if (columns == 0) {
      out.println("(no columns)");
      return;
    }

    // Split cells into lines and compute widths
    List<List<String[]>> prepared = new ArrayList<>(table.rows().size());
    int[] widths = new int[columns];
    for (List<String> row : table.rows()) {
      List<String[]> rowCells = new ArrayList<>(columns);
      for (int c = 0; c < columns; c++) {
        String cell = c < row.size() ? row.get(c) : "";
        String[] lines = cell.split("\\n", -1);
        rowCells.add(lines);
        for (String ln : lines) {
          widths[c] = Math.max(widths[c], Math.min(MAX_CELL_WIDTH, ln.length()));
        }
      }
      prepared.add(rowCells);
    }

    String sep = separator(widths);
    out.println(sep);
    for (int r = 0; r < prepared.size(); r++) {
      printRow(prepared.get(r), widths, out);
      if (r == 0 && table.hasHeader()) {
        out.println(sep.replace('-', '='));
      }
    }
    out.println(sep);
  }

  private static void printRow(List<String[]> rowCells, int[] widths, OutputWriter out) {
    int maxLines = 1;
    for (String[] cellLines : rowCells) maxLines = Math.max(maxLines, cellLines.length);
    for (int line = 0; line < maxLines; line++) {
      StringBuilder sb = new StringBuilder();
      for (int c = 0; c < widths.length; c++) {
        String[] cellLines = rowCells.get(c);
        String piece = line < cellLines.length ? cellLines[line] : "";
        sb.append("| ").append(fit(piece, widths[c])).append(" ");
      }
      sb.append("|");
      out.println(sb.toString());
    }
  }

  private static String separator(int[] widths) {
    StringBuilder sep = new StringBuilder();
    for (int w : widths) {
      sep.append("+").append("-".repeat(w + 2));
    }
    sep.append("+");
    return sep.toString();
  }

  // Widths never exceed MAX_CELL_WIDTH, so an overlong piece always has room for the ellipsis.
  private static String fit(String piece, int width) {
    if (piece.length() > width) {
      return piece.substring(0, width - 1) + ELLIPSIS;
    }
    return piece + " ".repeat(width - piece.length());
  }
}
