package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The call enum of a pallet. */
public record PalletCallMetadata(TypeId type) {
  public PalletCallMetadata {
    Objects.requireNonNull(type, "type");
  }
}
