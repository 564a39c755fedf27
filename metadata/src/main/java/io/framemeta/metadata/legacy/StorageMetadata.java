package io.framemeta.metadata.legacy;

import java.util.List;
import java.util.Objects;

/** Storage of one module: the key prefix and its entries. */
public record StorageMetadata(String prefix, List<StorageEntryMetadata> entries) {
  public StorageMetadata {
    Objects.requireNonNull(prefix, "prefix");
    entries = List.copyOf(entries);
  }
}
