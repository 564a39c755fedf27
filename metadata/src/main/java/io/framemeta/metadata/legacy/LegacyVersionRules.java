package io.framemeta.metadata.legacy;

import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.common.StorageHasher;
import java.util.List;

/**
 * Checks that legacy modules only use what their version can encode: module indices from V12,
 * NMap storage in V13, and hashers from the version's hasher table.
 */
public final class LegacyVersionRules {
  private LegacyVersionRules() {}

  /**
   * Validates the modules of a legacy tree.
   *
   * @param version the tree version, V8-V13
   * @param modules the modules
   * @throws IllegalArgumentException naming the first module that violates a rule
   */
  public static void validate(MetadataVersion version, List<ModuleMetadata> modules) {
    if (version.isRegistryBacked()) {
      throw new IllegalArgumentException(version + " is not a legacy version");
    }
    boolean indexed = !version.isBefore(MetadataVersion.V12);
    for (ModuleMetadata m : modules) {
      if (m.index().isPresent() != indexed) {
        throw new IllegalArgumentException(
            "Module "
                + m.name()
                + (indexed ? " needs an index in " : " cannot carry an index in ")
                + version);
      }
      if (m.storage().isEmpty()) {
        continue;
      }
      for (StorageEntryMetadata e : m.storage().get().entries()) {
        if (e.type() instanceof MapStorage map) {
          checkMap(version, m.name() + "." + e.name(), map);
        }
      }
    }
  }

  private static void checkMap(MetadataVersion version, String where, MapStorage map) {
    if (map.shape() == MapShape.N_MAP && version != MetadataVersion.V13) {
      throw new IllegalArgumentException("NMap storage " + where + " requires V13, not " + version);
    }
    for (StorageHasher h : map.hashers()) {
      if (!h.isAvailableIn(version)) {
        throw new IllegalArgumentException(
            "Hasher " + h + " of " + where + " is not available in " + version);
      }
    }
  }
}
