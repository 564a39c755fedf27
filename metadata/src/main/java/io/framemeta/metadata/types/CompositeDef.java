package io.framemeta.metadata.types;

import java.util.List;

/** A struct, with named or positional fields. */
public record CompositeDef(List<Field> fields) implements TypeDef {
  public CompositeDef {
    fields = List.copyOf(fields);
  }

  public static CompositeDef of(Field... fields) {
    return new CompositeDef(List.of(fields));
  }

  @Override
  public List<TypeId> references() {
    return fields.stream().map(Field::type).toList();
  }
}
