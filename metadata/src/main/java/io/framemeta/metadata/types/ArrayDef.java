package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

/**
 * A fixed-length array.
 *
 * @param length the element count, an unsigned 32-bit value
 * @param elementType the element type
 */
public record ArrayDef(long length, TypeId elementType) implements TypeDef {
  public ArrayDef {
    if (length < 0 || length > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("Array length out of u32 range: " + length);
    }
    Objects.requireNonNull(elementType, "elementType");
  }

  @Override
  public List<TypeId> references() {
    return List.of(elementType);
  }
}
