package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered type: its definition plus the naming information used for display.
 *
 * @param path module-qualified name segments, empty for anonymous types
 * @param typeParams generic parameter bindings
 * @param typeDef the definition
 * @param docs documentation lines
 */
public record TypeDescriptor(
    List<String> path, List<TypeParameter> typeParams, TypeDef typeDef, List<String> docs) {
  public TypeDescriptor {
    path = List.copyOf(path);
    typeParams = List.copyOf(typeParams);
    Objects.requireNonNull(typeDef, "typeDef");
    docs = List.copyOf(docs);
  }

  /** Creates an anonymous descriptor without parameters or docs. */
  public static TypeDescriptor of(TypeDef typeDef) {
    return new TypeDescriptor(List.of(), List.of(), typeDef, List.of());
  }

  /** Creates a named descriptor without parameters or docs. */
  public static TypeDescriptor named(List<String> path, TypeDef typeDef) {
    return new TypeDescriptor(path, List.of(), typeDef, List.of());
  }

  /** Returns the last path segment, if the type is named. */
  public Optional<String> simpleName() {
    return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
  }

  /** Finds the type bound to the generic parameter {@code name}. */
  public Optional<TypeId> typeParam(String name) {
    for (TypeParameter p : typeParams) {
      if (p.name().equals(name)) {
        return p.type();
      }
    }
    return Optional.empty();
  }
}
