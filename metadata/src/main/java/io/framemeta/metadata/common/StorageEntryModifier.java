package io.framemeta.metadata.common;

/**
 * How a storage entry behaves when no value is stored. Either way the entry's default bytes are
 * retained verbatim.
 */
public enum StorageEntryModifier {
  /** Reading an absent value yields none. */
  OPTIONAL,
  /** Reading an absent value yields the entry's default. */
  DEFAULT
}
