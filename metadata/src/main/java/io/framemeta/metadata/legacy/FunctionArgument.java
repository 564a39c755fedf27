package io.framemeta.metadata.legacy;

import java.util.Objects;

public record FunctionArgument(String name, String type) {
  public FunctionArgument {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
