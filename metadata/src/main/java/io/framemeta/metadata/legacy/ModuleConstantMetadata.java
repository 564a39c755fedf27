package io.framemeta.metadata.legacy;

import io.framemeta.codec.Bytes;
import java.util.List;
import java.util.Objects;

public record ModuleConstantMetadata(String name, String type, Bytes value, List<String> docs) {
  public ModuleConstantMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    docs = List.copyOf(docs);
  }
}
