package io.framemeta.metadata.v15;

import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletIndex;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A V15 pallet: the V14 pallet plus documentation. */
public record PalletMetadata(
    String name,
    Optional<PalletStorageMetadata> storage,
    Optional<PalletCallMetadata> calls,
    Optional<PalletEventMetadata> event,
    List<PalletConstantMetadata> constants,
    Optional<PalletErrorMetadata> error,
    int index,
    List<String> docs) {
  public PalletMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(calls, "calls");
    Objects.requireNonNull(event, "event");
    constants = List.copyOf(constants);
    Objects.requireNonNull(error, "error");
    PalletIndex.check(index);
    docs = List.copyOf(docs);
  }
}
