package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

public record PrimitiveDef(PrimitiveType primitive) implements TypeDef {
  public PrimitiveDef {
    Objects.requireNonNull(primitive, "primitive");
  }

  @Override
  public List<TypeId> references() {
    return List.of();
  }
}
