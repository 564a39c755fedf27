package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.ExtrinsicMetadata;
import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;
import java.util.Objects;

/** Version 13 runtime metadata: as V12, adding NMap storage. */
public record RuntimeMetadataV13(List<ModuleMetadata> modules, ExtrinsicMetadata extrinsic)
    implements RuntimeMetadata {
  public RuntimeMetadataV13 {
    modules = List.copyOf(modules);
    Objects.requireNonNull(extrinsic, "extrinsic");
    LegacyVersionRules.validate(MetadataVersion.V13, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V13;
  }
}
