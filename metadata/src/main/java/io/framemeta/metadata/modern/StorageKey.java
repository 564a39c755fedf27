package io.framemeta.metadata.modern;

import io.framemeta.metadata.common.StorageHasher;
import io.framemeta.metadata.types.TypeId;

/**
 * One key of a storage map after expansion against the registry.
 *
 * @param hasher the key hasher
 * @param keyType the key type
 */
public record StorageKey(StorageHasher hasher, TypeId keyType) {}
