package io.framemeta.metadata.api;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.internal.PayloadCodec;
import io.framemeta.metadata.internal.PayloadCodecs;
import io.framemeta.metadata.internal.TypeReferenceVerifier;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes the metadata envelope: the 4-byte magic {@code "meta"}, a one-byte version
 * discriminant and the payload of that version.
 *
 * <p>Decoding either yields a complete tree or throws; no partial results are returned. Instances
 * hold only their options and are safe to share between threads.
 */
public final class RuntimeMetadataCodec {
  private static final Logger log = LoggerFactory.getLogger(RuntimeMetadataCodec.class);

  /** The magic as a little-endian u32: the bytes {@code 6d 65 74 61}. */
  public static final long MAGIC = 0x6174656dL;

  /** Length of magic plus version discriminant. */
  public static final int HEADER_LENGTH = 5;

  private final MetadataOptions options;

  /** Creates a codec with {@link MetadataOptions#DEFAULT}. */
  public RuntimeMetadataCodec() {
    this(MetadataOptions.DEFAULT);
  }

  public RuntimeMetadataCodec(MetadataOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public MetadataOptions options() {
    return options;
  }

  /**
   * Reads the version discriminant without decoding the payload.
   *
   * @param data the encoded metadata
   * @return the raw discriminant, which need not be a supported version
   * @throws BadMagicException if the input does not start with the magic
   * @throws MalformedPayloadException if the input is shorter than the header
   */
  public static int versionOf(byte[] data) throws MetadataException {
    checkMagic(data);
    if (data.length < HEADER_LENGTH) {
      throw MalformedPayloadException.truncatedHeader(data.length);
    }
    return data[4] & 0xFF;
  }

  private static void checkMagic(byte[] data) throws MetadataException {
    if (data.length < 4) {
      throw MalformedPayloadException.truncatedHeader(data.length);
    }
    try {
      long magic = ScaleReader.of(data, 0, 4).readU32();
      if (magic != MAGIC) {
        throw new BadMagicException(magic);
      }
    } catch (ScaleCodecException e) {
      // four bytes were checked above
      throw new IllegalStateException(e);
    }
  }

  /**
   * Encodes a tree with its envelope.
   *
   * @param metadata the tree
   * @return the encoded bytes
   * @throws IllegalArgumentException if the tree's version is disabled by the options
   */
  public byte[] encode(RuntimeMetadata metadata) {
    MetadataVersion version = metadata.version();
    if (!options.isEnabled(version)) {
      log.warn("Refusing to encode {} metadata: version disabled", version);
      throw new IllegalArgumentException(version + " is disabled by the metadata options");
    }
    ScaleWriter w = new ScaleWriter(4096);
    w.writeU32(MAGIC).writeU8(version.tag());
    PayloadCodecs.forVersion(version).encode(w, metadata);
    log.debug("Encoded {} metadata: {} bytes", version, w.size());
    return w.toByteArray();
  }

  /**
   * Decodes metadata of any enabled version.
   *
   * @param data the encoded metadata
   * @return the tree
   * @throws BadMagicException if the magic does not match
   * @throws UnsupportedVersionException if the version is unknown, deprecated or disabled
   * @throws MalformedPayloadException if the payload is not a valid tree of its version
   * @throws DanglingTypeReferenceException if verification is on and a type id is missing
   */
  public RuntimeMetadata decode(byte[] data) throws MetadataException {
    if (data.length > options.maxInputBytes()) {
      throw MalformedPayloadException.tooLarge(data.length, options.maxInputBytes());
    }
    int tag = versionOf(data);
    MetadataVersion version =
        MetadataVersion.fromTag(tag).orElseThrow(() -> UnsupportedVersionException.unknown(tag));
    if (!options.isEnabled(version)) {
      log.warn("Metadata {} found but disabled by options", version);
      throw UnsupportedVersionException.disabled(version);
    }
    log.debug("Decoding {} metadata payload of {} bytes", version, data.length - HEADER_LENGTH);
    RuntimeMetadata metadata = decodePayload(version, data);
    if (options.verifyTypeReferences() && version.isRegistryBacked()) {
      verifyTypeReferences(metadata);
    }
    return metadata;
  }

  /**
   * Decodes metadata that must be of one specific version.
   *
   * @param data the encoded metadata
   * @param expected the required version
   * @return the tree
   * @throws UnsupportedVersionException if the input holds a different version
   */
  public RuntimeMetadata decode(byte[] data, MetadataVersion expected) throws MetadataException {
    int tag = versionOf(data);
    if (tag != expected.tag()) {
      throw new UnsupportedVersionException(tag, "expected " + expected);
    }
    return decode(data);
  }

  private static RuntimeMetadata decodePayload(MetadataVersion version, byte[] data)
      throws MalformedPayloadException {
    PayloadCodec<RuntimeMetadata> codec = PayloadCodecs.forVersion(version);
    ScaleReader reader = ScaleReader.of(data, HEADER_LENGTH, data.length - HEADER_LENGTH);
    try {
      RuntimeMetadata metadata = codec.decode(reader);
      reader.expectEnd(version + " payload");
      return metadata;
    } catch (ScaleCodecException e) {
      throw MalformedPayloadException.decoding(version, HEADER_LENGTH, e);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(
          "Invalid " + version + " payload: " + e.getMessage(),
          version,
          HEADER_LENGTH + reader.position(),
          e);
    }
  }

  /**
   * Checks that every type id in a registry-backed tree exists in its registry. Legacy trees
   * always pass.
   *
   * @param metadata the tree
   * @throws DanglingTypeReferenceException naming the first missing id and its field path
   */
  public static void verifyTypeReferences(RuntimeMetadata metadata)
      throws DanglingTypeReferenceException {
    TypeReferenceVerifier.verify(metadata);
  }
}
