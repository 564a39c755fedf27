package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The error enum of a V16 pallet and the deprecation of its variants. */
public record PalletErrorMetadata(TypeId type, DeprecationInfo deprecation) {
  public PalletErrorMetadata {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
