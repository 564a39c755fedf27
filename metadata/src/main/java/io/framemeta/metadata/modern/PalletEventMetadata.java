package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/** The event enum of a pallet. */
public record PalletEventMetadata(TypeId type) {
  public PalletEventMetadata {
    Objects.requireNonNull(type, "type");
  }
}
