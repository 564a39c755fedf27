package io.framemeta.metadata.api;

/** Thrown when a tree cannot be converted to the requested version. */
public class MetadataConversionException extends MetadataException {
  public static final String ERROR_CODE = "CONVERSION";

  private final MetadataVersion from;
  private final MetadataVersion to;

  public MetadataConversionException(String message, MetadataVersion from, MetadataVersion to) {
    this(message, from, to, ERROR_CODE);
  }

  protected MetadataConversionException(
      String message, MetadataVersion from, MetadataVersion to, String errorCode) {
    super(message, from + " -> " + to, errorCode);
    this.from = from;
    this.to = to;
  }

  public MetadataVersion getFrom() {
    return from;
  }

  public MetadataVersion getTo() {
    return to;
  }
}
