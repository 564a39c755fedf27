package io.framemeta.metadata.v16;

import java.util.Objects;
import java.util.Optional;

/** Whether an item is deprecated. */
public sealed interface DeprecationStatus
    permits DeprecationStatus.NotDeprecated,
        DeprecationStatus.DeprecatedWithoutNote,
        DeprecationStatus.Deprecated {

  /** Returns the shared not-deprecated status. */
  static DeprecationStatus notDeprecated() {
    return NotDeprecated.INSTANCE;
  }

  /** The item is not deprecated. */
  record NotDeprecated() implements DeprecationStatus {
    static final NotDeprecated INSTANCE = new NotDeprecated();
  }

  /** The item is deprecated without an explanation. */
  record DeprecatedWithoutNote() implements DeprecationStatus {}

  /**
   * The item is deprecated.
   *
   * @param note the deprecation note
   * @param since the version it was deprecated in, if recorded
   */
  record Deprecated(String note, Optional<String> since) implements DeprecationStatus {
    public Deprecated {
      Objects.requireNonNull(note, "note");
      Objects.requireNonNull(since, "since");
    }
  }
}
