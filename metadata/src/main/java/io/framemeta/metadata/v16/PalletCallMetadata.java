package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The call enum of a V16 pallet and the deprecation of its variants. */
public record PalletCallMetadata(TypeId type, DeprecationInfo deprecation) {
  public PalletCallMetadata {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
