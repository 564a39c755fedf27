package io.framemeta.metadata.types;

import java.util.List;

/** An anonymous product type; the empty tuple is the unit type. */
public record TupleDef(List<TypeId> fields) implements TypeDef {
  public TupleDef {
    fields = List.copyOf(fields);
  }

  public static TupleDef of(TypeId... fields) {
    return new TupleDef(List.of(fields));
  }

  @Override
  public List<TypeId> references() {
    return fields;
  }
}
