package io.framemeta.metadata.legacy;

import java.util.List;
import java.util.Objects;

/**
 * An event a module can emit.
 *
 * @param name the event name
 * @param arguments type names of the event's positional arguments
 * @param docs documentation lines
 */
public record EventMetadata(String name, List<String> arguments, List<String> docs) {
  public EventMetadata {
    Objects.requireNonNull(name, "name");
    arguments = List.copyOf(arguments);
    docs = List.copyOf(docs);
  }
}
