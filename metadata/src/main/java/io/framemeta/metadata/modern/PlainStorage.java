package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

public record PlainStorage(TypeId valueType) implements StorageEntryType {
  public PlainStorage {
    Objects.requireNonNull(valueType, "valueType");
  }
}
