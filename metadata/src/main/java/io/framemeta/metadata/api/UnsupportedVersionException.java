package io.framemeta.metadata.api;

/**
 * Thrown when the version discriminant names a version this build cannot decode: one of the
 * deprecated historical versions 0-7, a version newer than 16, or a version disabled through
 * {@link MetadataOptions#enabledVersions()}.
 */
public class UnsupportedVersionException extends MetadataException {
  public static final String ERROR_CODE = "UNSUPPORTED_VERSION";

  private final int tag;

  public UnsupportedVersionException(int tag, String reason) {
    super("Unsupported metadata version " + tag, reason, ERROR_CODE);
    this.tag = tag;
  }

  /**
   * Creates the exception for a discriminant that is known but excluded by the options.
   *
   * @param version the disabled version
   * @return a new exception
   */
  public static UnsupportedVersionException disabled(MetadataVersion version) {
    return new UnsupportedVersionException(version.tag(), "version disabled by options");
  }

  /**
   * Creates the exception for a discriminant outside the supported range.
   *
   * @param tag the raw discriminant
   * @return a new exception
   */
  public static UnsupportedVersionException unknown(int tag) {
    return new UnsupportedVersionException(
        tag, tag < MetadataVersion.V8.tag() ? "deprecated version" : "unknown version");
  }

  /** Returns the raw version discriminant. */
  public int getTag() {
    return tag;
  }
}
