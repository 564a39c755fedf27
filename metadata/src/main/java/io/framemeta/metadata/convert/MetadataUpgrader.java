package io.framemeta.metadata.convert;

import io.framemeta.metadata.api.MetadataConversionException;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataV10;
import io.framemeta.metadata.api.RuntimeMetadataV11;
import io.framemeta.metadata.api.RuntimeMetadataV12;
import io.framemeta.metadata.api.RuntimeMetadataV13;
import io.framemeta.metadata.api.RuntimeMetadataV14;
import io.framemeta.metadata.api.RuntimeMetadataV15;
import io.framemeta.metadata.api.RuntimeMetadataV8;
import io.framemeta.metadata.api.RuntimeMetadataV9;
import io.framemeta.metadata.api.UnsupportedDowngradeException;
import io.framemeta.metadata.legacy.ExtrinsicMetadata;
import io.framemeta.metadata.legacy.ModuleMetadata;
import io.framemeta.metadata.types.TypeDescriptor;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.PalletMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-way conversion of metadata to newer versions.
 *
 * <p>Single steps are chained until the target is reached. Fields that only exist in the newer
 * version get a fixed default, or are derived from the registry where a default would be wrong:
 *
 * <ul>
 *   <li>V10 to V11: extrinsic version 0 (unspecified) without signed extensions
 *   <li>V11 to V12: module index is the module's position
 *   <li>V14 to V15: empty pallet docs, no runtime APIs, no custom values; extrinsic component types
 *       from the generic parameters of the V14 extrinsic type; outer enums from the extrinsic's
 *       {@code Call} parameter and the {@code RuntimeEvent} and {@code RuntimeError} types
 * </ul>
 *
 * <p>V13 to V14 (inline names to a registry) and V15 to V16 (which drops extrinsic fields) are not
 * offered. Downgrades are never offered.
 */
public final class MetadataUpgrader {
  private static final Logger log = LoggerFactory.getLogger(MetadataUpgrader.class);

  private static final int MAX_MODULES = 256;

  private MetadataUpgrader() {}

  /**
   * Converts a tree to a newer (or the same) version.
   *
   * @param metadata the tree
   * @param target the version to produce
   * @return the converted tree; the input itself when it already has the target version
   * @throws UnsupportedDowngradeException if the target is older than the tree
   * @throws MetadataConversionException if a step on the way is not defined or cannot derive a
   *     required value
   */
  public static RuntimeMetadata upgrade(RuntimeMetadata metadata, MetadataVersion target)
      throws MetadataConversionException {
    MetadataVersion source = metadata.version();
    if (target.isBefore(source)) {
      throw new UnsupportedDowngradeException(source, target);
    }
    RuntimeMetadata current = metadata;
    while (current.version() != target) {
      MetadataVersion from = current.version();
      current = step(current);
      log.debug("Upgraded metadata {} -> {}", from, current.version());
    }
    return current;
  }

  /** Returns whether {@code from} can be upgraded to {@code to}. */
  public static boolean canUpgrade(MetadataVersion from, MetadataVersion to) {
    if (to.isBefore(from)) {
      return false;
    }
    boolean crossesRegistry =
        from.isBefore(MetadataVersion.V14) && !to.isBefore(MetadataVersion.V14);
    boolean crossesV16 = from.isBefore(MetadataVersion.V16) && to == MetadataVersion.V16;
    return !crossesRegistry && !crossesV16;
  }

  private static RuntimeMetadata step(RuntimeMetadata m) throws MetadataConversionException {
    if (m instanceof RuntimeMetadataV8 v8) {
      return new RuntimeMetadataV9(v8.modules());
    }
    if (m instanceof RuntimeMetadataV9 v9) {
      return new RuntimeMetadataV10(v9.modules());
    }
    if (m instanceof RuntimeMetadataV10 v10) {
      return new RuntimeMetadataV11(v10.modules(), ExtrinsicMetadata.unspecified());
    }
    if (m instanceof RuntimeMetadataV11 v11) {
      return toV12(v11);
    }
    if (m instanceof RuntimeMetadataV12 v12) {
      return new RuntimeMetadataV13(v12.modules(), v12.extrinsic());
    }
    if (m instanceof RuntimeMetadataV13) {
      throw new MetadataConversionException(
          "Inline type names cannot be converted into a type registry",
          MetadataVersion.V13,
          MetadataVersion.V14);
    }
    if (m instanceof RuntimeMetadataV14 v14) {
      return toV15(v14);
    }
    throw new MetadataConversionException(
        "V16 drops the extrinsic call and extra types, so V15 cannot be carried over losslessly",
        m.version(),
        MetadataVersion.V16);
  }

  private static RuntimeMetadataV12 toV12(RuntimeMetadataV11 m)
      throws MetadataConversionException {
    List<ModuleMetadata> modules = m.modules();
    if (modules.size() > MAX_MODULES) {
      throw new MetadataConversionException(
          modules.size() + " modules cannot be given single-byte indices",
          MetadataVersion.V11,
          MetadataVersion.V12);
    }
    List<ModuleMetadata> indexed = new ArrayList<>(modules.size());
    for (int i = 0; i < modules.size(); i++) {
      indexed.add(modules.get(i).withIndex(i));
    }
    return new RuntimeMetadataV12(indexed, m.extrinsic());
  }

  private static RuntimeMetadataV15 toV15(RuntimeMetadataV14 m)
      throws MetadataConversionException {
    TypeRegistry types = m.types();
    TypeId extrinsicId = m.extrinsic().type();
    TypeDescriptor extrinsicType =
        types
            .find(extrinsicId)
            .orElseThrow(() -> toV15Failure("extrinsic type " + extrinsicId + " is unknown"));
    TypeId address = param(extrinsicType, "Address");
    TypeId call = param(extrinsicType, "Call");
    TypeId signature = param(extrinsicType, "Signature");
    TypeId extra = param(extrinsicType, "Extra");
    TypeId event = named(types, "RuntimeEvent");
    TypeId error = named(types, "RuntimeError");

    List<PalletMetadata> pallets = new ArrayList<>(m.pallets().size());
    for (io.framemeta.metadata.v14.PalletMetadata p : m.pallets()) {
      pallets.add(
          new PalletMetadata(
              p.name(),
              p.storage(),
              p.calls(),
              p.event(),
              p.constants(),
              p.error(),
              p.index(),
              List.of()));
    }
    io.framemeta.metadata.v15.ExtrinsicMetadata extrinsic =
        new io.framemeta.metadata.v15.ExtrinsicMetadata(
            m.extrinsic().version(),
            address,
            call,
            signature,
            extra,
            m.extrinsic().signedExtensions());
    return new RuntimeMetadataV15(
        types,
        pallets,
        extrinsic,
        m.runtimeType(),
        List.of(),
        new OuterEnums(call, event, error),
        CustomMetadata.empty());
  }

  private static TypeId param(TypeDescriptor extrinsicType, String name)
      throws MetadataConversionException {
    Optional<TypeId> id = extrinsicType.typeParam(name);
    if (id.isEmpty()) {
      throw toV15Failure("extrinsic type has no '" + name + "' type parameter");
    }
    return id.get();
  }

  private static TypeId named(TypeRegistry types, String name)
      throws MetadataConversionException {
    return types
        .findByName(name)
        .orElseThrow(() -> toV15Failure("no '" + name + "' type in the registry"));
  }

  private static MetadataConversionException toV15Failure(String reason) {
    return new MetadataConversionException(
        "Cannot derive V15 fields: " + reason, MetadataVersion.V14, MetadataVersion.V15);
  }
}
