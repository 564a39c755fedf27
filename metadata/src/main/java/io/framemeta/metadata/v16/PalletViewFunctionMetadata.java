package io.framemeta.metadata.v16;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import java.util.List;
import java.util.Objects;

/**
 * A read-only function a pallet exposes for querying state.
 *
 * @param name the function name
 * @param id the 32-byte query identifier
 * @param inputs the parameters
 * @param output the result type
 * @param docs documentation lines
 * @param deprecation the deprecation status
 */
public record PalletViewFunctionMetadata(
    String name,
    Bytes id,
    List<RuntimeApiMethodParamMetadata> inputs,
    TypeId output,
    List<String> docs,
    DeprecationStatus deprecation) {
  /** Length of a view function identifier. */
  public static final int ID_LENGTH = 32;

  public PalletViewFunctionMetadata {
    Objects.requireNonNull(name, "name");
    if (id.length() != ID_LENGTH) {
      throw new IllegalArgumentException(
          "View function id must be " + ID_LENGTH + " bytes, got " + id.length());
    }
    inputs = List.copyOf(inputs);
    Objects.requireNonNull(output, "output");
    docs = List.copyOf(docs);
    Objects.requireNonNull(deprecation, "deprecation");
  }
}
