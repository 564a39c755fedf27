package io.framemeta.metadata.common;

import io.framemeta.metadata.api.MetadataVersion;
import java.util.List;

/**
 * Hash functions used to derive storage keys.
 *
 * <p>The wire index of a hasher depends on the metadata version: {@code Blake2_128Concat} was
 * inserted in V10 and {@code Identity} appended in V11, shifting the indices of the hashers after
 * them.
 */
public enum StorageHasher {
  BLAKE2_128,
  BLAKE2_256,
  BLAKE2_128_CONCAT,
  TWOX_128,
  TWOX_256,
  TWOX_64_CONCAT,
  IDENTITY;

  private static final List<StorageHasher> V8_TABLE =
      List.of(BLAKE2_128, BLAKE2_256, TWOX_128, TWOX_256, TWOX_64_CONCAT);
  private static final List<StorageHasher> V10_TABLE =
      List.of(BLAKE2_128, BLAKE2_256, BLAKE2_128_CONCAT, TWOX_128, TWOX_256, TWOX_64_CONCAT);
  private static final List<StorageHasher> V11_TABLE = List.of(values());

  /**
   * Returns the hashers encodable at a version, in wire-index order.
   *
   * @param version the metadata version
   * @return the table
   */
  public static List<StorageHasher> wireTable(MetadataVersion version) {
    if (version.isBefore(MetadataVersion.V10)) {
      return V8_TABLE;
    }
    if (version == MetadataVersion.V10) {
      return V10_TABLE;
    }
    return V11_TABLE;
  }

  /** Returns whether this hasher exists at the given version. */
  public boolean isAvailableIn(MetadataVersion version) {
    return wireTable(version).contains(this);
  }

  /**
   * Returns the wire index of this hasher at a version.
   *
   * @throws IllegalArgumentException if the hasher does not exist at that version
   */
  public int wireIndex(MetadataVersion version) {
    int idx = wireTable(version).indexOf(this);
    if (idx < 0) {
      throw new IllegalArgumentException(this + " cannot be encoded in " + version + " metadata");
    }
    return idx;
  }
}
