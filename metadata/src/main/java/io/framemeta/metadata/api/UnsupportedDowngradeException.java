package io.framemeta.metadata.api;

/** Thrown for any conversion to a lower version; metadata is never downgraded. */
public class UnsupportedDowngradeException extends MetadataConversionException {
  public static final String ERROR_CODE = "UNSUPPORTED_DOWNGRADE";

  public UnsupportedDowngradeException(MetadataVersion from, MetadataVersion to) {
    super("Cannot downgrade metadata from " + from + " to " + to, from, to, ERROR_CODE);
  }
}
