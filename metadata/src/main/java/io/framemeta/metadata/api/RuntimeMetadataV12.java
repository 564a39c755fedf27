package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.ExtrinsicMetadata;
import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;
import java.util.Objects;

/** Version 12 runtime metadata: as V11, with explicit module indices. */
public record RuntimeMetadataV12(List<ModuleMetadata> modules, ExtrinsicMetadata extrinsic)
    implements RuntimeMetadata {
  public RuntimeMetadataV12 {
    modules = List.copyOf(modules);
    Objects.requireNonNull(extrinsic, "extrinsic");
    LegacyVersionRules.validate(MetadataVersion.V12, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V12;
  }
}
