package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/**
 * A transaction extension.
 *
 * @param identifier the extension identifier
 * @param type the type carried in the extrinsic
 * @param implicit the type of the implicit data added to the signed payload
 */
public record TransactionExtensionMetadata(String identifier, TypeId type, TypeId implicit) {
  public TransactionExtensionMetadata {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(implicit, "implicit");
  }
}
