package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field of a composite type or of an enum variant.
 *
 * @param name the field name, empty for positional fields
 * @param type the field type
 * @param typeName the type name as written in the source, if recorded
 * @param docs documentation lines
 */
public record Field(
    Optional<String> name, TypeId type, Optional<String> typeName, List<String> docs) {
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(typeName, "typeName");
    docs = List.copyOf(docs);
  }

  public static Field named(String name, TypeId type, String typeName) {
    return new Field(Optional.of(name), type, Optional.ofNullable(typeName), List.of());
  }

  public static Field unnamed(TypeId type) {
    return new Field(Optional.empty(), type, Optional.empty(), List.of());
  }
}
