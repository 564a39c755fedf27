package io.framemeta.metadata.v15;

import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

public record RuntimeApiMethodMetadata(
    String name, List<RuntimeApiMethodParamMetadata> inputs, TypeId output, List<String> docs) {
  public RuntimeApiMethodMetadata {
    Objects.requireNonNull(name, "name");
    inputs = List.copyOf(inputs);
    Objects.requireNonNull(output, "output");
    docs = List.copyOf(docs);
  }
}
