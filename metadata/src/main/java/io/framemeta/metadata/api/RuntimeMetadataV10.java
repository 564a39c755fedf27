package io.framemeta.metadata.api;

import io.framemeta.metadata.legacy.LegacyVersionRules;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.List;

/** Version 10 runtime metadata; adds the {@code Blake2_128Concat} hasher. */
public record RuntimeMetadataV10(List<ModuleMetadata> modules) implements RuntimeMetadata {
  public RuntimeMetadataV10 {
    modules = List.copyOf(modules);
    LegacyVersionRules.validate(MetadataVersion.V10, modules);
  }

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V10;
  }
}
