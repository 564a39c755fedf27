package io.framemeta.metadata.legacy;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.common.StorageEntryModifier;
import java.util.List;
import java.util.Objects;

/**
 * A legacy storage entry.
 *
 * @param name the entry name
 * @param modifier behavior for absent values
 * @param type plain value or map
 * @param defaultValue the encoded default value, kept verbatim
 * @param docs documentation lines
 */
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
