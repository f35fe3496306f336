package io.jsontable.core.convert;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Turns records into string rows for a given {@link ArrayMode}. */
public final class RowMaterializer {
  private RowMaterializer() {}

  /**
   * Builds one row per record.
   *
   * @param mode layout chosen for the data
   * @param records records already cut to the row limit
   * @param header column names; only read for {@link ArrayMode#OBJECT_ROWS}
   * @return data rows, without a header
   */
  public static List<List<String>> materialize(
      ArrayMode mode, List<?> records, List<String> header) {
    List<List<String>> rows = new ArrayList<>(records.size());
    for (Object record : records) {
      rows.add(
          switch (mode) {
            case OBJECT_ROWS -> objectRow(record, header);
            case RAW_ROWS -> rawRow(record);
            case SCALAR_ROWS -> scalarRow(record);
          });
    }
    return rows;
  }

  /**
   * Row aligned to {@code header}. A record that is not an object keeps its text in the first cell
   * and the remaining cells are blank.
   */
  static List<String> objectRow(Object record, List<String> header) {
    if (record instanceof Map<?, ?> object) {
      Map<String, Object> fields = stringKeyed(object);
      List<String> row = new ArrayList<>(header.size());
      for (String key : header) {
        row.add(CellFormatter.format(fields.get(key)));
      }
      return row;
    }
    int width = Math.max(1, header.size());
    List<String> row = new ArrayList<>(width);
    row.add(CellFormatter.format(record));
    while (row.size() < width) {
      row.add("");
    }
    return row;
  }

  // Sorted maps with non-string keys throw on get(String); only string keys can match a column.
  private static Map<String, Object> stringKeyed(Map<?, ?> object) {
    Map<String, Object> fields = new HashMap<>(object.size() * 2);
    for (Map.Entry<?, ?> entry : object.entrySet()) {
      if (entry.getKey() instanceof String key) {
        fields.put(key, entry.getValue());
      }
    }
    return fields;
  }

  /** Cells of a nested array, in order. A non-array element becomes a single cell. */
  static List<String> rawRow(Object element) {
    if (element instanceof List<?> cells) {
      List<String> row = new ArrayList<>(cells.size());
      for (Object cell : cells) {
        row.add(CellFormatter.format(cell));
      }
      return row;
    }
    return scalarRow(element);
  }

  static List<String> scalarRow(Object element) {
    List<String> row = new ArrayList<>(1);
    row.add(CellFormatter.format(element));
    return row;
  }
}
