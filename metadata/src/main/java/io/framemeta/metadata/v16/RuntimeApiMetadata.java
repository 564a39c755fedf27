package io.framemeta.metadata.v16;

import java.util.List;
import java.util.Objects;

/**
 * A versioned runtime API trait.
 *
 * @param name the trait name
 * @param methods the methods
 * @param docs documentation lines
 * @param deprecation the deprecation status
 * @param version the trait version, an unsigned 32-bit value
 */
public record RuntimeApiMetadata(
    String name,
    List<RuntimeApiMethodMetadata> methods,
    List<String> docs,
    DeprecationStatus deprecation,
    long version) {
  public RuntimeApiMetadata {
    Objects.requireNonNull(name, "name");
    methods = List.copyOf(methods);
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
    if (version < 0 || version > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("API version out of u32 range: " + version);
    }
  }
}
