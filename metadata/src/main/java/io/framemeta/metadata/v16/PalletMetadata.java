package io.framemeta.metadata.v16;

import io.framemeta.metadata.modern.PalletIndex;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A V16 pallet. */
public record PalletMetadata(
    String name,
    Optional<PalletStorageMetadata> storage,
    Optional<PalletCallMetadata> calls,
    Optional<PalletEventMetadata> event,
    List<PalletConstantMetadata> constants,
    Optional<PalletErrorMetadata> error,
    List<PalletAssociatedTypeMetadata> associatedTypes,
    List<PalletViewFunctionMetadata> viewFunctions,
    int index,
    List<String> docs,
    DeprecationStatus deprecation) {
  public PalletMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(calls, "calls");
    Objects.requireNonNull(event, "event");
    constants = List.copyOf(constants);
    Objects.requireNonNull(error, "error");
    associatedTypes = List.copyOf(associatedTypes);
    viewFunctions = List.copyOf(viewFunctions);
    PalletIndex.check(index);
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
