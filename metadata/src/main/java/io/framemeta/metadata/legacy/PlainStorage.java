package io.framemeta.metadata.legacy;

import java.util.Objects;

/** A storage entry holding one value. */
public record PlainStorage(String valueType) implements StorageEntryType {
  public PlainStorage {
    Objects.requireNonNull(valueType, "valueType");
  }
}
