package io.framemeta.metadata.legacy;

import io.framemeta.metadata.common.StorageHasher;
import java.util.Objects;

/**
 * One key of a storage map: the hasher applied to it and its type name.
 *
 * @param hasher the key hasher
 * @param keyType the key type as an inline type name
 */
public record StorageKey(StorageHasher hasher, String keyType) {
  public StorageKey {
    Objects.requireNonNull(hasher, "hasher");
    Objects.requireNonNull(keyType, "keyType");
  }
}
