package io.framemeta.metadata.types;

import java.util.Objects;
import java.util.Optional;

/**
 * A generic parameter binding of a type, for display only.
 *
 * @param name the parameter name, e.g. {@code T}
 * @param type the bound type, empty when the parameter is phantom
 */
public record TypeParameter(String name, Optional<TypeId> type) {
  public TypeParameter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static TypeParameter of(String name, TypeId type) {
    return new TypeParameter(name, Optional.of(type));
  }
}
