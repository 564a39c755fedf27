package io.framemeta.metadata.types;

import java.util.List;
import java.util.Objects;

/**
 * One alternative of a variant (enum) type.
 *
 * @param name the variant name
 * @param fields the variant's fields, possibly none
 * @param index the discriminant byte, 0-255
 * @param docs documentation lines
 */
public record Variant(String name, List<Field> fields, int index, List<String> docs) {
  public Variant {
    Objects.requireNonNull(name, "name");
    if (index < 0 || index > 0xFF) {
      throw new IllegalArgumentException("Variant index out of u8 range: " + index);
    }
    fields = List.copyOf(fields);
    docs = List.copyOf(docs);
  }

  public static Variant of(String name, int index, Field... fields) {
    return new Variant(name, List.of(fields), index, List.of());
  }
}
