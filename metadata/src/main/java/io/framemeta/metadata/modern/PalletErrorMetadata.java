package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The error enum of a pallet. */
public record PalletErrorMetadata(TypeId type) {
  public PalletErrorMetadata {
    Objects.requireNonNull(type, "type");
  }
}
