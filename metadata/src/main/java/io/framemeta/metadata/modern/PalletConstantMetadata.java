package io.framemeta.metadata.modern;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

/**
 * A pallet constant.
 *
 * @param name the constant name
 * @param type the constant type
 * @param value the encoded value
 * @param docs documentation lines
 */
public record PalletConstantMetadata(String name, TypeId type, Bytes value, List<String> docs) {
  public PalletConstantMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    docs = List.copyOf(docs);
  }
}
