package io.framemeta.metadata.v15;

import java.util.Collections;
import java.util.Comparator;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Open-ended custom values, keyed by name. Keys are kept in {@link #KEY_ORDER}, which is also
 * their encoding order.
 */
public record CustomMetadata(SortedMap<String, CustomValueMetadata> map) {
  /**
   * Orders keys by their UTF-8 bytes. Code point order is the same order; UTF-16 code unit order
   * ({@link String#compareTo}) is not once supplementary characters appear.
   */
  public static final Comparator<String> KEY_ORDER = CustomMetadata::compareUtf8;

  private static final CustomMetadata EMPTY = new CustomMetadata(new TreeMap<>());

  public CustomMetadata {
    TreeMap<String, CustomValueMetadata> sorted = new TreeMap<>(KEY_ORDER);
    sorted.putAll(map);
    map = Collections.unmodifiableSortedMap(sorted);
  }

  public static CustomMetadata empty() {
    return EMPTY;
  }

  private static int compareUtf8(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Integer.compare(a.length() - i, b.length() - j);
  }
}
