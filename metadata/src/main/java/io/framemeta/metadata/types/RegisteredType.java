package io.framemeta.metadata.types;

import java.util.Objects;

/** A registry entry: an id and the descriptor it names. */
public record RegisteredType(TypeId id, TypeDescriptor type) {
  public RegisteredType {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
  }
}
