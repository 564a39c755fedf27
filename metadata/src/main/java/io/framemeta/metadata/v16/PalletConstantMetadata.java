package io.framemeta.metadata.v16;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

public record PalletConstantMetadata(
    String name, TypeId type, Bytes value, List<String> docs, DeprecationStatus deprecation) {
  public PalletConstantMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
