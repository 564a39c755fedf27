package io.framemeta.metadata.v16;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** Deprecation of an enum type as a whole, or of some of its variants. */
public sealed interface DeprecationInfo
    permits DeprecationInfo.NotDeprecated,
        DeprecationInfo.ItemDeprecated,
        DeprecationInfo.VariantsDeprecated {

  /** Returns the shared not-deprecated info. */
  static DeprecationInfo notDeprecated() {
    return NotDeprecated.INSTANCE;
  }

  /** Neither the enum nor any variant is deprecated. */
  record NotDeprecated() implements DeprecationInfo {
    static final NotDeprecated INSTANCE = new NotDeprecated();
  }

  /** The whole enum is deprecated. */
  record ItemDeprecated(DeprecationStatus status) implements DeprecationInfo {
    public ItemDeprecated {
      Objects.requireNonNull(status, "status");
    }
  }

  /**
   * Individual variants are deprecated.
   *
   * @param variants deprecation by variant index
   */
  record VariantsDeprecated(SortedMap<Integer, DeprecationStatus> variants)
      implements DeprecationInfo {
    public VariantsDeprecated {
      for (Integer idx : variants.keySet()) {
        if (idx < 0 || idx > 0xFF) {
          throw new IllegalArgumentException("Variant index out of u8 range: " + idx);
        }
      }
      TreeMap<Integer, DeprecationStatus> sorted = new TreeMap<>();
      sorted.putAll(variants);
      variants = Collections.unmodifiableSortedMap(sorted);
    }
  }
}
