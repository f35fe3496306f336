package io.jsontable.core;

import io.jsontable.core.convert.ArrayMode;
import io.jsontable.core.convert.HeaderExtractor;
import io.jsontable.core.convert.RowLimitPolicy;
import io.jsontable.core.convert.RowMaterializer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a decoded JSON value into a {@link TableMatrix}.
 *
 * <p>Accepted shapes:
 *
 * <ul>
 *   <li>an object, rendered as a single row keyed by its own fields
 *   <li>an array of objects, with columns collected from the objects' keys
 *   <li>an array of arrays, each inner array a row
 *   <li>an array of scalars, each one a single-cell row under a {@code Value} header
 * </ul>
 *
 * <p>The layout of an array is decided by its first element. Later elements of a different shape
 * are tolerated: in an object array a non-object element keeps its text in the first column.
 *
 * <p>Input is the plain object tree a JSON decoder produces ({@link Map}, {@link List}, strings,
 * numbers, booleans, {@code null}); it is never modified. Instances are immutable and may be shared
 * between threads.
 */
public final class JsonTableConverter {
  private static final Logger log = LoggerFactory.getLogger(JsonTableConverter.class);

  /** Header of a scalar array. */
  public static final String VALUE_COLUMN = "Value";

  private final ConversionConfig config;
  private final DiagnosticsSink diagnostics;

  /** Creates a converter with default bounds that reports notices through SLF4J. */
  public JsonTableConverter() {
    this(ConversionConfig.defaults(), new Slf4jDiagnosticsSink());
  }

  public JsonTableConverter(ConversionConfig config, DiagnosticsSink diagnostics) {
    this.config = Objects.requireNonNull(config, "config");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  public ConversionConfig config() {
    return config;
  }

  /**
   * Converts with this converter's bounds.
   *
   * @see #convert(Object, boolean, Integer, ConversionConfig)
   */
  public TableMatrix convert(Object value, boolean includeHeader, Integer limit) {
    return convert(value, includeHeader, limit, config);
  }

  /**
   * Converts {@code value} into a table.
   *
   * @param value decoded JSON value
   * @param includeHeader whether the first row holds column names; for an array of arrays the
   *     first inner array is used as that row
   * @param limit {@code null} for the default cap, {@code 0} for all rows, or a positive row count
   * @param bounds bounds for this call
   * @return freshly built table
   * @throws EmptyDataException if {@code value} is null, an empty object or an empty array
   * @throws InvalidShapeException if {@code value} is a scalar or an array starting with null
   * @throws IllegalArgumentException if {@code limit} is negative
   */
  public TableMatrix convert(
      Object value, boolean includeHeader, Integer limit, ConversionConfig bounds) {
    Objects.requireNonNull(bounds, "bounds");

    List<?> records;
    ArrayMode mode;
    if (value == null) {
      throw EmptyDataException.noData();
    } else if (value instanceof Map<?, ?> object) {
      if (object.isEmpty()) {
        throw EmptyDataException.noData();
      }
      records = Collections.singletonList(object);
      mode = ArrayMode.OBJECT_ROWS;
    } else if (value instanceof List<?> array) {
      if (array.isEmpty()) {
        throw EmptyDataException.noData();
      }
      records = array;
      mode = ArrayMode.of(array.get(0));
    } else {
      throw InvalidShapeException.scalarRoot(value);
    }
    log.debug("Converting {} records as {}", records.size(), mode);

    RowLimitPolicy.Resolution resolution =
        RowLimitPolicy.resolve(records.size(), limit, bounds.defaultCap());
    if (resolution.hasDiagnostic()) {
      diagnostics.emit(resolution.level(), resolution.message());
    }
    List<?> limited = resolution.limit().apply(records);

    List<String> header =
        switch (mode) {
          case OBJECT_ROWS -> new HeaderExtractor(bounds).extract(limited);
          case SCALAR_ROWS -> List.of(VALUE_COLUMN);
          case RAW_ROWS -> List.of();
        };
    List<List<String>> dataRows = RowMaterializer.materialize(mode, limited, header);

    // An array of arrays carries its own header as the first inner array.
    boolean prepend = includeHeader && mode != ArrayMode.RAW_ROWS;
    List<List<String>> rows = new ArrayList<>(dataRows.size() + 1);
    if (prepend) {
      rows.add(header);
    }
    rows.addAll(dataRows);

    log.debug("Converted {} data rows, {} columns", dataRows.size(), header.size());
    return new TableMatrix(rows, includeHeader);
  }
}
