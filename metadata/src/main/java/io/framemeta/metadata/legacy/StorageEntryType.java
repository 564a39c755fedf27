package io.framemeta.metadata.legacy;

/** The shape of a legacy storage entry: a single value or a map. */
public sealed interface StorageEntryType permits PlainStorage, MapStorage {

  /** Returns the stored value's inline type name. */
  String valueType();
}
