package io.framemeta.metadata.api;

import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v14.ExtrinsicMetadata;
import io.framemeta.metadata.v14.PalletMetadata;
import java.util.List;
import java.util.Objects;

/**
 * Version 14 runtime metadata, the first version that describes types through a registry.
 *
 * @param types the type registry every id in the tree refers to
 * @param pallets the pallets, in declaration order
 * @param extrinsic the extrinsic format
 * @param runtimeType the type of the runtime itself
 */
public record RuntimeMetadataV14(
    TypeRegistry types,
    List<PalletMetadata> pallets,
    ExtrinsicMetadata extrinsic,
    TypeId runtimeType)
    implements RuntimeMetadata {
  public RuntimeMetadataV14 {
    Objects.requireNonNull(types, "types");
    pallets = List.copyOf(pallets);
    Objects.requireNonNull(extrinsic, "extrinsic");
    Objects.requireNonNull(runtimeType, "runtimeType");
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V14;
  }
}
