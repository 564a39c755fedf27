package io.framemeta.metadata.v15;

import io.framemeta.metadata.modern.SignedExtensionMetadata;
import io.framemeta.metadata.types.TypeId;
import java.util.List;
import java.util.Objects;

/**
 * The V15 extrinsic format, with the component types spelled out.
 *
 * @param version the extrinsic format version byte
 * @param addressType the address type
 * @param callType the call type
 * @param signatureType the signature type
 * @param extraType the type of the signed extensions' extra data
 * @param signedExtensions the signed extensions, in order
 */
public record ExtrinsicMetadata(
    int version,
    TypeId addressType,
    TypeId callType,
    TypeId signatureType,
    TypeId extraType,
    List<SignedExtensionMetadata> signedExtensions) {
  public ExtrinsicMetadata {
    if (version < 0 || version > 0xFF) {
      throw new IllegalArgumentException("Extrinsic version out of u8 range: " + version);
    }
    Objects.requireNonNull(addressType, "addressType");
    Objects.requireNonNull(callType, "callType");
    Objects.requireNonNull(signatureType, "signatureType");
    Objects.requireNonNull(extraType, "extraType");
    signedExtensions = List.copyOf(signedExtensions);
  }
}
