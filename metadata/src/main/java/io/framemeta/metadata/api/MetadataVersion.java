package io.framemeta.metadata.api;

import java.util.Optional;

/** The runtime metadata versions this library can decode and encode. */
public enum MetadataVersion {
  V8(8, false),
  V9(9, false),
  V10(10, false),
  V11(11, false),
  V12(12, false),
  V13(13, false),
  V14(14, true),
  V15(15, true),
  V16(16, true);

  private final int tag;
  private final boolean registryBacked;

  MetadataVersion(int tag, boolean registryBacked) {
    this.tag = tag;
    this.registryBacked = registryBacked;
  }

  /** Returns the version discriminant written after the magic. */
  public int tag() {
    return tag;
  }

  /** Returns whether trees of this version embed a type registry. */
  public boolean isRegistryBacked() {
    return registryBacked;
  }

  /**
   * Looks up a version by its discriminant.
   *
   * @param tag the discriminant
   * @return the version, or empty when the discriminant is not a supported version
   */
  public static Optional<MetadataVersion> fromTag(int tag) {
    if (tag < V8.tag || tag > V16.tag) {
      return Optional.empty();
    }
    return Optional.of(values()[tag - V8.tag]);
  }

  /** Returns the newest supported version. */
  public static MetadataVersion latest() {
    return V16;
  }

  /** Returns whether this version is older than {@code other}. */
  public boolean isBefore(MetadataVersion other) {
    return tag < other.tag;
  }

  /** Returns the next version, or empty for the latest. */
  public Optional<MetadataVersion> next() {
    return fromTag(tag + 1);
  }
}
