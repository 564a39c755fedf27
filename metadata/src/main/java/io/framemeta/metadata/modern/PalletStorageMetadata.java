package io.framemeta.metadata.modern;

import java.util.List;
import java.util.Objects;

public record PalletStorageMetadata(String prefix, List<StorageEntryMetadata> entries) {
  public PalletStorageMetadata {
    Objects.requireNonNull(prefix, "prefix");
    entries = List.copyOf(entries);
  }
}
