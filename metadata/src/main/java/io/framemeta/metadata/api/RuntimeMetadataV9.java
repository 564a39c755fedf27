package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;

/** Version 9 runtime metadata. Same structure as V8. */
public record RuntimeMetadataV9(List<ModuleMetadata> modules) implements RuntimeMetadata {
  public RuntimeMetadataV9 {
    modules = List.copyOf(modules);
    LegacyVersionRules.validate(MetadataVersion.V9, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V9;
  }
}
