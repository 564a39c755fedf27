package io.framemeta.metadata.legacy;

import java.util.List;
import java.util.Objects;

public record ErrorMetadata(String name, List<String> docs) {
  public ErrorMetadata {
    Objects.requireNonNull(name, "name");
    docs = List.copyOf(docs);
  }
}
