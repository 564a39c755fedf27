package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.ExtrinsicMetadata;
import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;
import java.util.Objects;

/** Version 11 runtime metadata: modules with inline type names, plus the extrinsic format. */
public record RuntimeMetadataV11(List<ModuleMetadata> modules, ExtrinsicMetadata extrinsic)
    implements RuntimeMetadata {
  public RuntimeMetadataV11 {
    modules = List.copyOf(modules);
    Objects.requireNonNull(extrinsic, "extrinsic");
    LegacyVersionRules.validate(MetadataVersion.V11, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V11;
  }
}
