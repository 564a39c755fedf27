package io.framemeta.metadata.legacy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A module of a legacy runtime.
 *
 * @param name the module name
 * @param storage the module storage, if any
 * @param calls the dispatchable calls, empty when the module has no call enum
 * @param events the events, empty when the module has no event enum
 * @param constants the constants
 * @param errors the errors
 * @param index the explicit module index; present exactly from V12 on
 */
public record ModuleMetadata(
    String name,
    Optional<StorageMetadata> storage,
    Optional<List<FunctionMetadata>> calls,
    Optional<List<EventMetadata>> events,
    List<ModuleConstantMetadata> constants,
    List<ErrorMetadata> errors,
    OptionalInt index) {
  public ModuleMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(storage, "storage");
    calls = calls.map(List::copyOf);
    events = events.map(List::copyOf);
    constants = List.copyOf(constants);
    errors = List.copyOf(errors);
    Objects.requireNonNull(index, "index");
    if (index.isPresent() && (index.getAsInt() < 0 || index.getAsInt() > 0xFF)) {
      throw new IllegalArgumentException("Module index out of u8 range: " + index.getAsInt());
    }
  }

  /** Returns a copy with the given module index. */
  public ModuleMetadata withIndex(int newIndex) {
    return new ModuleMetadata(
        name, storage, calls, events, constants, errors, OptionalInt.of(newIndex));
  }
}
