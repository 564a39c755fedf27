package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

/** An associated type of a pallet's configuration trait. */
public record PalletAssociatedTypeMetadata(String name, TypeId type, List<String> docs) {
  public PalletAssociatedTypeMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    docs = List.copyOf(docs);
  }
}
