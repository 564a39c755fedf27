package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;

/** Version 8 runtime metadata: modules with inline type names. */
public record RuntimeMetadataV8(List<ModuleMetadata> modules) implements RuntimeMetadata {
  public RuntimeMetadataV8 {
    modules = List.copyOf(modules);
    LegacyVersionRules.validate(MetadataVersion.V8, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V8;
  }
}
