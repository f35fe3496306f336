package io.jsontable.core.convert;

import io.jsontable.core.ConversionConfig;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects column names from a list of objects.
 *
 * <p>Names keep the key order of the first object; keys first seen in later objects are appended in
 * the order they appear. Only the first {@code maxObjects} records are scanned and at most {@code
 * maxKeys} names are kept, so the work is bounded whatever the input looks like. Once the name
 * budget is used up, later keys are dropped.
 */
public final class HeaderExtractor {
  private final int maxObjects;
  private final int maxKeys;
  private final int maxKeyLength;

  public HeaderExtractor(ConversionConfig config) {
    this.maxObjects = config.maxObjects();
    this.maxKeys = config.maxKeys();
    this.maxKeyLength = config.maxKeyLength();
  }

  /**
   * Extracts column names.
   *
   * @param records records to scan; non-object entries are ignored
   * @return ordered, distinct column names
   */
  public List<String> extract(List<?> records) {
    Set<String> accepted = new LinkedHashSet<>();
    Iterator<?> it = records.iterator();
    for (int scanned = 0; scanned < maxObjects && it.hasNext(); scanned++) {
      Object record = it.next();
      if (!HeaderFilters.isObjectRecord(record)) {
        continue;
      }
      for (Object key : ((Map<?, ?>) record).keySet()) {
        if (!HeaderFilters.hasKeyCapacity(accepted.size(), maxKeys)) {
          return List.copyOf(accepted);
        }
        if (acceptsKey(key)) {
          accepted.add((String) key);
        }
      }
    }
    return List.copyOf(accepted);
  }

  private boolean acceptsKey(Object key) {
    if (!HeaderFilters.isStringKey(key)) {
      return false;
    }
    String name = (String) key;
    return HeaderFilters.isNonEmptyKey(name) && HeaderFilters.fitsKeyLength(name, maxKeyLength);
  }
}
