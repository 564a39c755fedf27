package io.framemeta.metadata.v14;

import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletIndex;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A V14 pallet.
 *
 * @param name the pallet name
 * @param storage the storage, if any
 * @param calls the call enum, if any
 * @param event the event enum, if any
 * @param constants the constants
 * @param error the error enum, if any
 * @param index the pallet index, independent of its position in the list
 */
public record PalletMetadata(
    String name,
    Optional<PalletStorageMetadata> storage,
    Optional<PalletCallMetadata> calls,
    Optional<PalletEventMetadata> event,
    List<PalletConstantMetadata> constants,
    Optional<PalletErrorMetadata> error,
    int index) {
  public PalletMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(calls, "calls");
    Objects.requireNonNull(event, "event");
    constants = List.copyOf(constants);
    Objects.requireNonNull(error, "error");
    PalletIndex.check(index);
  }
}
