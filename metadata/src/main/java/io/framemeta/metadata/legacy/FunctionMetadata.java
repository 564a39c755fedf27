package io.framemeta.metadata.legacy;

import java.util.List;
import java.util.Objects;

/** A dispatchable call of a module. */
public record FunctionMetadata(String name, List<FunctionArgument> arguments, List<String> docs) {
  public FunctionMetadata {
    Objects.requireNonNull(name, "name");
    arguments = List.copyOf(arguments);
    docs = List.copyOf(docs);
  }
}
