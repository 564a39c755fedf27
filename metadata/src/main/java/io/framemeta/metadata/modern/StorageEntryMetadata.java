package io.framemeta.metadata.modern;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.common.StorageEntryModifier;
import java.util.List;
import java.util.Objects;

/** A storage entry of a V14 or V15 pallet. */
public record StorageEntryMetadata(
    String name,
    StorageEntryModifier modifier,
    StorageEntryType type,
    Bytes defaultValue,
    List<String> docs) {
  public StorageEntryMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(modifier, "modifier");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
    docs = List.copyOf(docs);
  }
}
