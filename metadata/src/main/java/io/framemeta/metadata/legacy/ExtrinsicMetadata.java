package io.framemeta.metadata.legacy;

import java.util.List;

/**
 * Extrinsic format of V11-V13 runtimes.
 *
 * @param version the extrinsic format version byte; 0 means unspecified
 * @param signedExtensions identifiers of the signed extensions, in order
 */
public record ExtrinsicMetadata(int version, List<String> signedExtensions) {
  public ExtrinsicMetadata {
    if (version < 0 || version > 0xFF) {
      throw new IllegalArgumentException("Extrinsic version out of u8 range: " + version);
    }
    signedExtensions = List.copyOf(signedExtensions);
  }

  /** The extrinsic assumed for runtimes that predate its declaration. */
  public static ExtrinsicMetadata unspecified() {
    return new ExtrinsicMetadata(0, List.of());
  }
}
