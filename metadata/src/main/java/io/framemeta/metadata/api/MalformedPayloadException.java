package io.framemeta.metadata.api;

import io.framemeta.codec.ScaleCodecException;
import java.util.Optional;

/**
 * Thrown when the bytes after the envelope header (or a JSON document) do not form a valid tree
 * of the announced version.
 */
public class MalformedPayloadException extends MetadataException {
  public static final String ERROR_CODE = "MALFORMED_PAYLOAD";

  private final MetadataVersion version;
  private final int offset;

  public MalformedPayloadException(
      String message, MetadataVersion version, int offset, Throwable cause) {
    super(message, cause, contextOf(version, offset), ERROR_CODE);
    this.version = version;
    this.offset = offset;
  }

  public MalformedPayloadException(String message, String context) {
    super(message, context, ERROR_CODE);
    this.version = null;
    this.offset = -1;
  }

  private static String contextOf(MetadataVersion version, int offset) {
    StringBuilder sb = new StringBuilder();
    if (version != null) {
      sb.append(version);
    }
    if (offset >= 0) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("offset ").append(offset);
    }
    return sb.length() == 0 ? null : sb.toString();
  }

  /**
   * Wraps a codec failure inside a version payload.
   *
   * @param version the version being decoded
   * @param payloadStart absolute offset of the payload, added to the codec offset
   * @param cause the codec failure
   * @return a new exception
   */
  public static MalformedPayloadException decoding(
      MetadataVersion version, int payloadStart, ScaleCodecException cause) {
    return new MalformedPayloadException(
        "Malformed " + version + " payload: " + cause.getMessage(),
        version,
        payloadStart + cause.getOffset(),
        cause);
  }

  /**
   * Creates the exception for an input too short to hold the envelope header.
   *
   * @param length the input length
   * @return a new exception
   */
  public static MalformedPayloadException truncatedHeader(int length) {
    return new MalformedPayloadException(
        "Input of " + length + " bytes is too short for the metadata header", null, length, null);
  }

  /**
   * Creates the exception for an input rejected by {@link MetadataOptions#maxInputBytes()}.
   *
   * @param length the input length
   * @param max the configured maximum
   * @return a new exception
   */
  public static MalformedPayloadException tooLarge(long length, long max) {
    return new MalformedPayloadException(
        "Input of " + length + " bytes exceeds the limit of " + max + " bytes", "maxInputBytes");
  }

  /** Returns the version whose payload was being decoded, if known. */
  public Optional<MetadataVersion> getVersion() {
    return Optional.ofNullable(version);
  }

  /** Returns the absolute byte offset of the failure, or -1 when not applicable. */
  public int getOffset() {
    return offset;
  }
}
