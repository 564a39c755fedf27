package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;

/** The shape of a registry-backed storage entry: a single value or a map. */
public sealed interface StorageEntryType permits PlainStorage, MapStorage {

  /** Returns the stored value's type. */
  TypeId valueType();
}
