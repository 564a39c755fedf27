package io.framemeta.metadata.v16;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.common.StorageEntryModifier;
import io.framemeta.metadata.modern.StorageEntryType;
import java.util.List;
import java.util.Objects;

/** A V16 storage entry, carrying its deprecation status. */
public record StorageEntryMetadata(
    String name,
    StorageEntryModifier modifier,
    StorageEntryType type,
    Bytes defaultValue,
    List<String> docs,
    DeprecationStatus deprecation) {
  public StorageEntryMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(modifier, "modifier");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
