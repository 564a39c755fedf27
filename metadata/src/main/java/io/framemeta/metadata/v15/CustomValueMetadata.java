package io.framemeta.metadata.v15;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

public record CustomValueMetadata(TypeId type, Bytes value) {
  public CustomValueMetadata {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
  }
}
