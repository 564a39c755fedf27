package io.framemeta.metadata.internal;

import io.framemeta.metadata.api.DanglingTypeReferenceException;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataV14;
import io.framemeta.metadata.api.RuntimeMetadataV15;
import io.framemeta.metadata.api.RuntimeMetadataV16;
import io.framemeta.metadata.modern.MapStorage;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import io.framemeta.metadata.modern.SignedExtensionMetadata;
import io.framemeta.metadata.modern.StorageEntryMetadata;
import io.framemeta.metadata.modern.StorageEntryType;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.CustomValueMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import io.framemeta.metadata.v16.PalletAssociatedTypeMetadata;
import io.framemeta.metadata.v16.PalletViewFunctionMetadata;
import io.framemeta.metadata.v16.TransactionExtensionMetadata;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that every type id reachable from a registry-backed tree is present in the tree's
 * registry. Failures name the id and the path of the field holding it, e.g. {@code
 * pallets[Balances].storage.entries[TotalIssuance]}.
 */
public final class TypeReferenceVerifier {
  private final TypeRegistry types;

  private TypeReferenceVerifier(TypeRegistry types) {
    this.types = types;
  }

  /**
   * Verifies a tree. Legacy trees carry no type ids and always pass.
   *
   * @param metadata the tree
   * @throws DanglingTypeReferenceException for the first id not in the registry
   */
  public static void verify(RuntimeMetadata metadata) throws DanglingTypeReferenceException {
    if (metadata instanceof RuntimeMetadataV14 m) {
      new TypeReferenceVerifier(m.types()).verifyV14(m);
    } else if (metadata instanceof RuntimeMetadataV15 m) {
      new TypeReferenceVerifier(m.types()).verifyV15(m);
    } else if (metadata instanceof RuntimeMetadataV16 m) {
      new TypeReferenceVerifier(m.types()).verifyV16(m);
    }
  }

  private void check(TypeId id, String path) throws DanglingTypeReferenceException {
    if (!types.contains(id)) {
      throw new DanglingTypeReferenceException(id.id(), path);
    }
  }

  private void verifyV14(RuntimeMetadataV14 m) throws DanglingTypeReferenceException {
    types.verifyClosure();
    for (io.framemeta.metadata.v14.PalletMetadata p : m.pallets()) {
      String path = "pallets[" + p.name() + "]";
      verifyStorage(p.storage(), path);
      if (p.calls().isPresent()) {
        check(p.calls().get().type(), path + ".calls");
      }
      if (p.event().isPresent()) {
        check(p.event().get().type(), path + ".event");
      }
      verifyConstants(p.constants(), path);
      if (p.error().isPresent()) {
        check(p.error().get().type(), path + ".error");
      }
    }
    check(m.extrinsic().type(), "extrinsic.type");
    verifySignedExtensions(m.extrinsic().signedExtensions());
    check(m.runtimeType(), "runtimeType");
  }

  private void verifyV15(RuntimeMetadataV15 m) throws DanglingTypeReferenceException {
    types.verifyClosure();
    for (io.framemeta.metadata.v15.PalletMetadata p : m.pallets()) {
      String path = "pallets[" + p.name() + "]";
      verifyStorage(p.storage(), path);
      if (p.calls().isPresent()) {
        check(p.calls().get().type(), path + ".calls");
      }
      if (p.event().isPresent()) {
        check(p.event().get().type(), path + ".event");
      }
      verifyConstants(p.constants(), path);
      if (p.error().isPresent()) {
        check(p.error().get().type(), path + ".error");
      }
    }
    io.framemeta.metadata.v15.ExtrinsicMetadata x = m.extrinsic();
    check(x.addressType(), "extrinsic.addressType");
    check(x.callType(), "extrinsic.callType");
    check(x.signatureType(), "extrinsic.signatureType");
    check(x.extraType(), "extrinsic.extraType");
    verifySignedExtensions(x.signedExtensions());
    check(m.runtimeType(), "runtimeType");
    for (io.framemeta.metadata.v15.RuntimeApiMetadata api : m.apis()) {
      for (io.framemeta.metadata.v15.RuntimeApiMethodMetadata method : api.methods()) {
        String path = "apis[" + api.name() + "].methods[" + method.name() + "]";
        verifyParams(method.inputs(), path);
        check(method.output(), path + ".output");
      }
    }
    verifyOuterEnums(m.outerEnums());
    verifyCustom(m.custom());
  }

  private void verifyV16(RuntimeMetadataV16 m) throws DanglingTypeReferenceException {
    types.verifyClosure();
    for (io.framemeta.metadata.v16.PalletMetadata p : m.pallets()) {
      String path = "pallets[" + p.name() + "]";
      if (p.storage().isPresent()) {
        for (io.framemeta.metadata.v16.StorageEntryMetadata e : p.storage().get().entries()) {
          verifyEntryType(e.type(), path + ".storage.entries[" + e.name() + "]");
        }
      }
      if (p.calls().isPresent()) {
        check(p.calls().get().type(), path + ".calls");
      }
      if (p.event().isPresent()) {
        check(p.event().get().type(), path + ".event");
      }
      for (io.framemeta.metadata.v16.PalletConstantMetadata c : p.constants()) {
        check(c.type(), path + ".constants[" + c.name() + "]");
      }
      if (p.error().isPresent()) {
        check(p.error().get().type(), path + ".error");
      }
      for (PalletAssociatedTypeMetadata a : p.associatedTypes()) {
        check(a.type(), path + ".associatedTypes[" + a.name() + "]");
      }
      for (PalletViewFunctionMetadata f : p.viewFunctions()) {
        String fpath = path + ".viewFunctions[" + f.name() + "]";
        verifyParams(f.inputs(), fpath);
        check(f.output(), fpath + ".output");
      }
    }
    io.framemeta.metadata.v16.ExtrinsicMetadata x = m.extrinsic();
    check(x.addressType(), "extrinsic.addressType");
    check(x.signatureType(), "extrinsic.signatureType");
    for (TransactionExtensionMetadata e : x.transactionExtensions()) {
      String path = "extrinsic.transactionExtensions[" + e.identifier() + "]";
      check(e.type(), path + ".type");
      check(e.implicit(), path + ".implicit");
    }
    for (io.framemeta.metadata.v16.RuntimeApiMetadata api : m.apis()) {
      for (io.framemeta.metadata.v16.RuntimeApiMethodMetadata method : api.methods()) {
        String path = "apis[" + api.name() + "].methods[" + method.name() + "]";
        verifyParams(method.inputs(), path);
        check(method.output(), path + ".output");
      }
    }
    verifyOuterEnums(m.outerEnums());
    verifyCustom(m.custom());
  }

  private void verifyStorage(Optional<PalletStorageMetadata> storage, String path)
      throws DanglingTypeReferenceException {
    if (storage.isEmpty()) {
      return;
    }
    for (StorageEntryMetadata e : storage.get().entries()) {
      verifyEntryType(e.type(), path + ".storage.entries[" + e.name() + "]");
    }
  }

  private void verifyEntryType(StorageEntryType type, String path)
      throws DanglingTypeReferenceException {
    if (type instanceof MapStorage map) {
      check(map.keyType(), path + ".key");
    }
    check(type.valueType(), path);
  }

  private void verifyConstants(List<PalletConstantMetadata> constants, String path)
      throws DanglingTypeReferenceException {
    for (PalletConstantMetadata c : constants) {
      check(c.type(), path + ".constants[" + c.name() + "]");
    }
  }

  private void verifySignedExtensions(List<SignedExtensionMetadata> extensions)
      throws DanglingTypeReferenceException {
    for (SignedExtensionMetadata e : extensions) {
      String path = "extrinsic.signedExtensions[" + e.identifier() + "]";
      check(e.type(), path + ".type");
      check(e.additionalSigned(), path + ".additionalSigned");
    }
  }

  private void verifyParams(List<RuntimeApiMethodParamMetadata> params, String path)
      throws DanglingTypeReferenceException {
    for (RuntimeApiMethodParamMetadata p : params) {
      check(p.type(), path + ".inputs[" + p.name() + "]");
    }
  }

  private void verifyOuterEnums(OuterEnums e) throws DanglingTypeReferenceException {
    check(e.callEnumType(), "outerEnums.callEnumType");
    check(e.eventEnumType(), "outerEnums.eventEnumType");
    check(e.errorEnumType(), "outerEnums.errorEnumType");
  }

  private void verifyCustom(CustomMetadata custom) throws DanglingTypeReferenceException {
    for (Map.Entry<String, CustomValueMetadata> e : custom.map().entrySet()) {
      check(e.getValue().type(), "custom[" + e.getKey() + "]");
    }
  }
}
