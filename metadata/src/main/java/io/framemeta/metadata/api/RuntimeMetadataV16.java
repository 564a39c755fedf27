package io.framemeta.metadata.api;

import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v16.ExtrinsicMetadata;
import io.framemeta.metadata.v16.PalletMetadata;
import io.framemeta.metadata.v16.RuntimeApiMetadata;
import java.util.List;
import java.util.Objects;

/**
 * Version 16 runtime metadata: deprecation information, pallet associated types and view
 * functions, versioned runtime APIs and transaction extensions. The runtime type is gone.
 *
 * @param types the type registry every id in the tree refers to
 * @param pallets the pallets, in declaration order
 * @param extrinsic the extrinsic format
 * @param apis the runtime APIs
 * @param outerEnums the aggregate call, event and error enums
 * @param custom custom values
 */
public record RuntimeMetadataV16(
    TypeRegistry types,
    List<PalletMetadata> pallets,
    ExtrinsicMetadata extrinsic,
    List<RuntimeApiMetadata> apis,
    OuterEnums outerEnums,
    CustomMetadata custom)
    implements RuntimeMetadata {
  public RuntimeMetadataV16 {
    Objects.requireNonNull(types, "types");
    pallets = List.copyOf(pallets);
    Objects.requireNonNull(extrinsic, "extrinsic");
    apis = List.copyOf(apis);
    Objects.requireNonNull(outerEnums, "outerEnums");
    Objects.requireNonNull(custom, "custom");
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V16;
  }
}
