package io.framemeta.metadata.v15;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

public record RuntimeApiMethodParamMetadata(String name, TypeId type) {
  public RuntimeApiMethodParamMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
