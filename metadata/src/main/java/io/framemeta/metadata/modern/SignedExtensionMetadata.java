package io.framemeta.metadata.modern;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/**
 * A signed extension of the extrinsic format.
 *
 * @param identifier the extension identifier
 * @param type the type carried in the extrinsic
 * @param additionalSigned the type of the extra data added to the signed payload
 */
public record SignedExtensionMetadata(String identifier, TypeId type, TypeId additionalSigned) {
  public SignedExtensionMetadata {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(additionalSigned, "additionalSigned");
  }
}
