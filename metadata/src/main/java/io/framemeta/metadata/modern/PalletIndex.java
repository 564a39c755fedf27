package io.framemeta.metadata.modern;

/** Validation of pallet indices, which are a single byte on the wire. */
public final class PalletIndex {
  private PalletIndex() {}

  /**
   * Checks a pallet index.
   *
   * @param index the index
   * @return the index
   * @throws IllegalArgumentException if it does not fit a byte
   */
  public static int check(int index) {
    if (index < 0 || index > 0xFF) {
      throw new IllegalArgumentException("Pallet index out of u8 range: " + index);
    }
    return index;
  }
}
