package io.framemeta.metadata.util;

import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataV10;
import io.framemeta.metadata.api.RuntimeMetadataV11;
import io.framemeta.metadata.api.RuntimeMetadataV12;
import io.framemeta.metadata.api.RuntimeMetadataV13;
import io.framemeta.metadata.api.RuntimeMetadataV14;
import io.framemeta.metadata.api.RuntimeMetadataV15;
import io.framemeta.metadata.api.RuntimeMetadataV16;
import io.framemeta.metadata.api.RuntimeMetadataV8;
import io.framemeta.metadata.api.RuntimeMetadataV9;
import io.framemeta.metadata.legacy.ModuleMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/** Version-independent views of a metadata tree. */
public final class MetadataSummary {
  private MetadataSummary() {}

  /**
   * A pallet (or legacy module) name with its index.
   *
   * @param name the name
   * @param index the declared index; for V8-V11 modules, which declare none, the list position
   */
  public record PalletInfo(String name, int index) {}

  /**
   * Lists pallets, or modules of legacy trees, in declaration order.
   *
   * @param metadata the tree
   * @return names and indices
   */
  public static List<PalletInfo> pallets(RuntimeMetadata metadata) {
    List<PalletInfo> out = new ArrayList<>();
    if (metadata instanceof RuntimeMetadataV14 m) {
      m.pallets().forEach(p -> out.add(new PalletInfo(p.name(), p.index())));
    } else if (metadata instanceof RuntimeMetadataV15 m) {
      m.pallets().forEach(p -> out.add(new PalletInfo(p.name(), p.index())));
    } else if (metadata instanceof RuntimeMetadataV16 m) {
      m.pallets().forEach(p -> out.add(new PalletInfo(p.name(), p.index())));
    } else {
      List<ModuleMetadata> modules = legacyModules(metadata);
      for (int i = 0; i < modules.size(); i++) {
        ModuleMetadata mod = modules.get(i);
        out.add(new PalletInfo(mod.name(), mod.index().orElse(i)));
      }
    }
    return out;
  }

  /** Returns the pallet (or module) names in declaration order. */
  public static List<String> palletNames(RuntimeMetadata metadata) {
    return pallets(metadata).stream().map(PalletInfo::name).toList();
  }

  /**
   * Finds the position of a pallet by name, ignoring ASCII case.
   *
   * @param metadata the tree
   * @param name the pallet name
   * @return the position in the pallet list, or empty
   */
  public static OptionalInt palletIndex(RuntimeMetadata metadata, String name) {
    List<String> names = palletNames(metadata);
    for (int i = 0; i < names.size(); i++) {
      if (names.get(i).equalsIgnoreCase(name)) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  /** Returns the number of registered types, 0 for legacy trees. */
  public static int registrySize(RuntimeMetadata metadata) {
    if (metadata instanceof RuntimeMetadataV14 m) {
      return m.types().size();
    }
    if (metadata instanceof RuntimeMetadataV15 m) {
      return m.types().size();
    }
    if (metadata instanceof RuntimeMetadataV16 m) {
      return m.types().size();
    }
    return 0;
  }

  /** Returns a one-line description such as {@code V14: 3 pallets, 120 types}. */
  public static String describe(RuntimeMetadata metadata) {
    int pallets = pallets(metadata).size();
    StringBuilder sb = new StringBuilder();
    sb.append(metadata.version()).append(": ").append(pallets);
    sb.append(metadata.version().isRegistryBacked() ? " pallets" : " modules");
    if (metadata.version().isRegistryBacked()) {
      sb.append(", ").append(registrySize(metadata)).append(" types");
    }
    return sb.toString();
  }

  private static List<ModuleMetadata> legacyModules(RuntimeMetadata metadata) {
    if (metadata instanceof RuntimeMetadataV8 m) {
      return m.modules();
    }
    if (metadata instanceof RuntimeMetadataV9 m) {
      return m.modules();
    }
    if (metadata instanceof RuntimeMetadataV10 m) {
      return m.modules();
    }
    if (metadata instanceof RuntimeMetadataV11 m) {
      return m.modules();
    }
    if (metadata instanceof RuntimeMetadataV12 m) {
      return m.modules();
    }
    return ((RuntimeMetadataV13) metadata).modules();
  }
}
