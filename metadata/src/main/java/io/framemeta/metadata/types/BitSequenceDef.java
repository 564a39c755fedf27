package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

/**
 * A bit vector.
 *
 * @param bitStoreType the storage word type, e.g. {@code u8}
 * @param bitOrderType the bit order marker type, e.g. {@code Lsb0}
 */
public record BitSequenceDef(TypeId bitStoreType, TypeId bitOrderType) implements TypeDef {
  public BitSequenceDef {
    Objects.requireNonNull(bitStoreType, "bitStoreType");
    Objects.requireNonNull(bitOrderType, "bitOrderType");
  }

  @Override
  public List<TypeId> references() {
    return List.of(bitStoreType, bitOrderType);
  }
}
