package io.jsontable.core.convert;

import java.util.Map;

/** Conditions a record or key must meet to contribute a column name. */
public final class HeaderFilters {
  private HeaderFilters() {}

  /** Only objects carry column names; anything else in an object array is skipped. */
  public static boolean isObjectRecord(Object record) {
    return record instanceof Map<?, ?>;
  }

  public static boolean isStringKey(Object key) {
    return key instanceof String;
  }

  public static boolean isNonEmptyKey(String key) {
    return !key.isEmpty();
  }

  /** Keys of exactly {@code maxKeyLength} characters are kept. */
  public static boolean fitsKeyLength(String key, int maxKeyLength) {
    return key.length() <= maxKeyLength;
  }

  /** True while fewer than {@code maxKeys} names have been accepted. */
  public static boolean hasKeyCapacity(int acceptedCount, int maxKeys) {
    return acceptedCount < maxKeys;
  }
}
