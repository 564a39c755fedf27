package io.framemeta.metadata.legacy;

/** The historical wire variant a legacy storage map was encoded as. */
public enum MapShape {
  /** Single-key map, wire variant 1. */
  MAP,
  /** Two-key map, wire variant 2. */
  DOUBLE_MAP,
  /** Map with any number of keys, wire variant 3, V13 only. */
  N_MAP
}
