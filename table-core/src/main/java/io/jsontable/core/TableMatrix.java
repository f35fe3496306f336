package io.jsontable.core;

import java.util.List;

/**
 * Result of a conversion: rows of string cells, optionally led by a header row.
 *
 * <p>Rows built from objects all share the header width. Rows built from nested arrays keep their
 * own widths; padding them is left to the renderer.
 *
 * @param rows all rows, header first when {@code hasHeader} is set
 * @param hasHeader whether row 0 holds column names
 */
public record TableMatrix(List<List<String>> rows, boolean hasHeader) {

  public TableMatrix {
    rows = rows.stream().map(List::copyOf).toList();
    if (hasHeader && rows.isEmpty()) {
      throw new IllegalArgumentException("header requested but matrix has no rows");
    }
  }

  /** Returns the header row, or an empty list when there is none. */
  public List<String> header() {
    return hasHeader ? rows.get(0) : List.of();
  }

  /** Returns the rows after the header. */
  public List<List<String>> dataRows() {
    return hasHeader ? rows.subList(1, rows.size()) : rows;
  }

  public int dataRowCount() {
    return hasHeader ? rows.size() - 1 : rows.size();
  }

  /** Width of the widest row. */
  public int width() {
    int width = 0;
    for (List<String> row : rows) {
      width = Math.max(width, row.size());
    }
    return width;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
