package io.framemeta.metadata.api;

/** Thrown when the input does not start with the {@code "meta"} marker. */
public class BadMagicException extends MetadataException {
  public static final String ERROR_CODE = "BAD_MAGIC";

  private final long found;

  public BadMagicException(long found) {
    this(
        "Input is not runtime metadata: expected magic 0x6174656d",
        String.format("found 0x%08x", found),
        found);
  }

  private BadMagicException(String message, String context, long found) {
    super(message, context, ERROR_CODE);
    this.found = found;
  }

  /**
   * Creates the exception for a text document whose magic field is not {@code "meta"}.
   *
   * @param found the magic text found, or null when the field is missing
   * @return a new exception
   */
  public static BadMagicException ofText(String found) {
    return new BadMagicException(
        "Document is not runtime metadata: expected magic \"meta\"",
        found == null ? "magic missing" : "found \"" + found + "\"",
        -1);
  }

  /**
   * Returns the 32-bit little-endian value found where the magic was expected, or -1 for text
   * documents.
   */
  public long getFound() {
    return found;
  }
}
