package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The event enum of a V16 pallet and the deprecation of its variants. */
public record PalletEventMetadata(TypeId type, DeprecationInfo deprecation) {
  public PalletEventMetadata {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
