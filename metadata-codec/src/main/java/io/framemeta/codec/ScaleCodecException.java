package io.framemeta.codec;

/**
 * Thrown when a byte sequence is not a valid compact-binary encoding of the value being read.
 *
 * <p>Carries the offset, relative to the start of the reader's window, at which decoding failed.
 */
public class ScaleCodecException extends Exception {
  /** Byte offset where the failure was detected. */
  private final int offset;

  /**
   * Constructs a new ScaleCodecException.
   *
   * @param message the detail message
   * @param offset the byte offset where decoding failed
   */
  public ScaleCodecException(String message, int offset) {
    super(message + " at offset " + offset);
    this.offset = offset;
  }

  /**
   * Gets the byte offset where decoding failed.
   *
   * @return the failing offset
   */
  public int getOffset() {
    return offset;
  }
}
