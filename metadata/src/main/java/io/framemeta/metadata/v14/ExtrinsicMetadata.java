package io.framemeta.metadata.v14;

import io.framemeta.metadata.modern.SignedExtensionMetadata;
import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

/**
 * The V14 extrinsic format.
 *
 * @param type the extrinsic type, whose generic parameters name the address, call, signature and
 *     extra types
 * @param version the extrinsic format version byte
 * @param signedExtensions the signed extensions, in order
 */
public record ExtrinsicMetadata(
    TypeId type, int version, List<SignedExtensionMetadata> signedExtensions) {
  public ExtrinsicMetadata {
    Objects.requireNonNull(type, "type");
    if (version < 0 || version > 0xFF) {
      throw new IllegalArgumentException("Extrinsic version out of u8 range: " + version);
    }
    signedExtensions = List.copyOf(signedExtensions);
  }
}
