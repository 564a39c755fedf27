package io.framemeta.metadata.api;

import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.ExtrinsicMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.PalletMetadata;
import io.framemeta.metadata.v15.RuntimeApiMetadata;
import java.util.List;
import java.util.Objects;

/**
 * Version 15 runtime metadata: V14 plus runtime APIs, outer enums and custom values.
 *
 * @param types the type registry every id in the tree refers to
 * @param pallets the pallets, in declaration order
 * @param extrinsic the extrinsic format
 * @param runtimeType the type of the runtime itself
 * @param apis the runtime APIs
 * @param outerEnums the aggregate call, event and error enums
 * @param custom custom values
 */
public record RuntimeMetadataV15(
    TypeRegistry types,
    List<PalletMetadata> pallets,
    ExtrinsicMetadata extrinsic,
    TypeId runtimeType,
    List<RuntimeApiMetadata> apis,
    OuterEnums outerEnums,
    CustomMetadata custom)
    implements RuntimeMetadata {
  public RuntimeMetadataV15 {
    Objects.requireNonNull(types, "types");
    pallets = List.copyOf(pallets);
    Objects.requireNonNull(extrinsic, "extrinsic");
    Objects.requireNonNull(runtimeType, "runtimeType");
    apis = List.copyOf(apis);
    Objects.requireNonNull(outerEnums, "outerEnums");
    Objects.requireNonNull(custom, "custom");
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V15;
  }
}
