package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import java.util.List;
import java.util.Objects;

public record RuntimeApiMethodMetadata(
    String name,
    List<RuntimeApiMethodParamMetadata> inputs,
    TypeId output,
    List<String> docs,
    DeprecationStatus deprecation) {
  public RuntimeApiMethodMetadata {
    Objects.requireNonNull(name, "name");
    inputs = List.copyOf(inputs);
    Objects.requireNonNull(output, "output");
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
