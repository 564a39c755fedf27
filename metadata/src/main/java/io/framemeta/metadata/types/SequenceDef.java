package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

/** A variable-length sequence of one element type. */
public record SequenceDef(TypeId elementType) implements TypeDef {
  public SequenceDef {
    Objects.requireNonNull(elementType, "elementType");
  }

  @Override
  public List<TypeId> references() {
    return List.of(elementType);
  }
}
