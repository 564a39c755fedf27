package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

/** Compact encoding wrapper around an unsigned integer type. */
public record CompactDef(TypeId wrappedType) implements TypeDef {
  public CompactDef {
    Objects.requireNonNull(wrappedType, "wrappedType");
  }

  @Override
  public List<TypeId> references() {
    return List.of(wrappedType);
  }
}
