package io.framemeta.metadata.v15;

import java.util.List;
import java.util.Objects;

/** A runtime API trait exposed by the runtime. */
public record RuntimeApiMetadata(
    String name, List<RuntimeApiMethodMetadata> methods, List<String> docs) {
  public RuntimeApiMetadata {
    Objects.requireNonNull(name, "name");
    methods = List.copyOf(methods);
    docs = List.copyOf(docs);
  }
}
