package io.framemeta.metadata.fixtures;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.api.MetadataVersion;
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
import io.framemeta.metadata.common.StorageEntryModifier;
import io.framemeta.metadata.common.StorageHasher;
import io.framemeta.metadata.legacy.ErrorMetadata;
import io.framemeta.metadata.legacy.EventMetadata;
import io.framemeta.metadata.legacy.ExtrinsicMetadata;
import io.framemeta.metadata.legacy.FunctionArgument;
import io.framemeta.metadata.legacy.FunctionMetadata;
import io.framemeta.metadata.legacy.MapShape;
import io.framemeta.metadata.legacy.MapStorage;
import io.framemeta.metadata.legacy.ModuleConstantMetadata;
import io.framemeta.metadata.legacy.ModuleMetadata;
import io.framemeta.metadata.legacy.PlainStorage;
import io.framemeta.metadata.legacy.StorageEntryMetadata;
import io.framemeta.metadata.legacy.StorageKey;
import io.framemeta.metadata.legacy.StorageMetadata;
import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import io.framemeta.metadata.modern.SignedExtensionMetadata;
import io.framemeta.metadata.types.ArrayDef;
import io.framemeta.metadata.types.BitSequenceDef;
import io.framemeta.metadata.types.CompactDef;
import io.framemeta.metadata.types.CompositeDef;
import io.framemeta.metadata.types.Field;
import io.framemeta.metadata.types.PrimitiveType;
import io.framemeta.metadata.types.SequenceDef;
import io.framemeta.metadata.types.TupleDef;
import io.framemeta.metadata.types.TypeDescriptor;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeParameter;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.types.Variant;
import io.framemeta.metadata.types.VariantDef;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.CustomValueMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import io.framemeta.metadata.v16.DeprecationInfo;
import io.framemeta.metadata.v16.DeprecationStatus;
import io.framemeta.metadata.v16.PalletAssociatedTypeMetadata;
import io.framemeta.metadata.v16.PalletViewFunctionMetadata;
import io.framemeta.metadata.v16.TransactionExtensionMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/** Synthetic metadata trees of every version, built in code. */
public final class MetadataFixtures {
  private MetadataFixtures() {}

  /** Type ids of the registry built by {@link #registry()}. */
  public record Types(
      TypeRegistry registry,
      TypeId u8,
      TypeId u32,
      TypeId u128,
      TypeId bool,
      TypeId bytes,
      TypeId accountId,
      TypeId accountAndIndex,
      TypeId compactBalance,
      TypeId bits,
      TypeId tree,
      TypeId call,
      TypeId event,
      TypeId error,
      TypeId extrinsic,
      TypeId runtime,
      TypeId unit) {}

  /**
   * Builds a small registry shaped like a real runtime's: primitives, an account id, a recursive
   * type, aggregate call/event/error enums and an extrinsic type with the usual generic
   * parameters.
   */
  public static Types registry() {
    TypeRegistry.Builder b = TypeRegistry.builder();
    TypeId u8 = b.primitive(PrimitiveType.U8);
    TypeId u32 = b.primitive(PrimitiveType.U32);
    TypeId u128 = b.primitive(PrimitiveType.U128);
    TypeId bool = b.primitive(PrimitiveType.BOOL);
    TypeId bytes = b.register(new SequenceDef(u8));
    TypeId raw32 = b.register(new ArrayDef(32, u8));
    TypeId accountId =
        b.register(
            TypeDescriptor.named(
                List.of("sp_core", "crypto", "AccountId32"),
                CompositeDef.of(Field.unnamed(raw32))));
    TypeId accountAndIndex = b.register(TupleDef.of(accountId, u32));
    TypeId compactBalance = b.register(new CompactDef(u128));
    TypeId lsb0 =
        b.register(TypeDescriptor.named(List.of("bitvec", "order", "Lsb0"), CompositeDef.of()));
    TypeId bits = b.register(new BitSequenceDef(u8, lsb0));

    // Tree { children: Vec<Tree> }
    TypeId tree = b.reserve();
    TypeId children = b.register(new SequenceDef(tree));
    b.define(
        tree,
        TypeDescriptor.named(
            List.of("fixture", "Tree"),
            CompositeDef.of(Field.named("children", children, "Vec<Tree>"))));

    TypeId balancesCall =
        b.register(
            new TypeDescriptor(
                List.of("pallet_balances", "pallet", "Call"),
                List.of(new TypeParameter("T", Optional.empty())),
                VariantDef.of(
                    new Variant(
                        "transfer",
                        List.of(
                            Field.named("dest", accountId, "AccountId"),
                            Field.named("value", compactBalance, "Balance")),
                        0,
                        List.of("Transfer some balance.")),
                    Variant.of("remark", 1)),
                List.of("Balances calls.")));
    TypeId call =
        b.register(
            TypeDescriptor.named(
                List.of("fixture_runtime", "RuntimeCall"),
                VariantDef.of(Variant.of("Balances", 5, Field.unnamed(balancesCall)))));
    TypeId event =
        b.register(
            TypeDescriptor.named(
                List.of("fixture_runtime", "RuntimeEvent"),
                VariantDef.of(
                    Variant.of(
                        "Transfer",
                        0,
                        Field.named("from", accountId, null),
                        Field.named("amount", u128, "T::Balance")))));
    TypeId error =
        b.register(
            TypeDescriptor.named(
                List.of("fixture_runtime", "RuntimeError"),
                VariantDef.of(Variant.of("InsufficientBalance", 0))));
    TypeId unit = b.register(TupleDef.of());
    TypeId extrinsic =
        b.register(
            new TypeDescriptor(
                List.of("sp_runtime", "generic", "UncheckedExtrinsic"),
                List.of(
                    TypeParameter.of("Address", accountId),
                    TypeParameter.of("Call", call),
                    TypeParameter.of("Signature", bytes),
                    TypeParameter.of("Extra", unit)),
                CompositeDef.of(Field.unnamed(bytes)),
                List.of()));
    TypeId runtime =
        b.register(TypeDescriptor.named(List.of("fixture_runtime", "Runtime"), CompositeDef.of()));
    return new Types(
        b.build(),
        u8,
        u32,
        u128,
        bool,
        bytes,
        accountId,
        accountAndIndex,
        compactBalance,
        bits,
        tree,
        call,
        event,
        error,
        extrinsic,
        runtime,
        unit);
  }

  // legacy

  /** Returns a tree of the given legacy version using every feature that version supports. */
  public static RuntimeMetadata legacy(MetadataVersion version) {
    List<ModuleMetadata> modules = legacyModules(version);
    ExtrinsicMetadata extrinsic = new ExtrinsicMetadata(4, List.of("CheckNonce", "CheckWeight"));
    switch (version) {
      case V8:
        return new RuntimeMetadataV8(modules);
      case V9:
        return new RuntimeMetadataV9(modules);
      case V10:
        return new RuntimeMetadataV10(modules);
      case V11:
        return new RuntimeMetadataV11(modules, extrinsic);
      case V12:
        return new RuntimeMetadataV12(modules, extrinsic);
      case V13:
        return new RuntimeMetadataV13(modules, extrinsic);
      default:
        throw new IllegalArgumentException(version + " is not a legacy version");
    }
  }

  public static List<ModuleMetadata> legacyModules(MetadataVersion version) {
    boolean indexed = !version.isBefore(MetadataVersion.V12);
    StorageHasher mapHasher =
        version.isBefore(MetadataVersion.V10)
            ? StorageHasher.BLAKE2_256
            : StorageHasher.BLAKE2_128_CONCAT;
    List<StorageEntryMetadata> entries =
        new ArrayList<>(
            List.of(
                new StorageEntryMetadata(
                    "Number",
                    StorageEntryModifier.DEFAULT,
                    new PlainStorage("T::BlockNumber"),
                    Bytes.fromHex("00000000"),
                    List.of("The current block number.")),
                new StorageEntryMetadata(
                    "Account",
                    StorageEntryModifier.OPTIONAL,
                    new MapStorage(
                        List.of(new StorageKey(mapHasher, "T::AccountId")),
                        "AccountInfo",
                        MapShape.MAP,
                        true),
                    Bytes.empty(),
                    List.of()),
                new StorageEntryMetadata(
                    "Approvals",
                    StorageEntryModifier.DEFAULT,
                    MapStorage.doubleMap(
                        StorageHasher.BLAKE2_128,
                        "T::AccountId",
                        StorageHasher.TWOX_64_CONCAT,
                        "T::Hash",
                        "bool"),
                    Bytes.fromHex("00"),
                    List.of())));
    if (version == MetadataVersion.V13) {
      entries.add(
          new StorageEntryMetadata(
              "Triple",
              StorageEntryModifier.OPTIONAL,
              MapStorage.nMap(
                  List.of(
                      new StorageKey(StorageHasher.IDENTITY, "u8"),
                      new StorageKey(StorageHasher.TWOX_64_CONCAT, "u16"),
                      new StorageKey(StorageHasher.BLAKE2_128_CONCAT, "u32")),
                  "u64"),
              Bytes.empty(),
              List.of("Keyed by three values.")));
    }
    ModuleMetadata system =
        new ModuleMetadata(
            "System",
            Optional.of(new StorageMetadata("System", entries)),
            Optional.of(
                List.of(
                    new FunctionMetadata(
                        "remark",
                        List.of(new FunctionArgument("remark", "Vec<u8>")),
                        List.of("Make some on-chain remark.")))),
            Optional.of(
                List.of(
                    new EventMetadata(
                        "ExtrinsicSuccess", List.of("DispatchInfo"), List.of("Success.")))),
            List.of(
                new ModuleConstantMetadata(
                    "BlockHashCount", "T::BlockNumber", Bytes.fromHex("60090000"), List.of())),
            List.of(new ErrorMetadata("InvalidSpecName", List.of("Bad spec name."))),
            indexed ? OptionalInt.of(0) : OptionalInt.empty());
    ModuleMetadata balances =
        new ModuleMetadata(
            "Balances",
            Optional.empty(),
            Optional.of(List.of()),
            Optional.empty(),
            List.of(),
            List.of(),
            indexed ? OptionalInt.of(10) : OptionalInt.empty());
    return List.of(system, balances);
  }

  // modern

  private static PalletStorageMetadata balancesStorage(Types t) {
    return new PalletStorageMetadata(
        "Balances",
        List.of(
            new io.framemeta.metadata.modern.StorageEntryMetadata(
                "TotalIssuance",
                StorageEntryModifier.DEFAULT,
                new io.framemeta.metadata.modern.PlainStorage(t.u128()),
                Bytes.of(new byte[16]),
                List.of(" The total units issued in the system.")),
            new io.framemeta.metadata.modern.StorageEntryMetadata(
                "Locks",
                StorageEntryModifier.OPTIONAL,
                new io.framemeta.metadata.modern.MapStorage(
                    List.of(StorageHasher.BLAKE2_128_CONCAT, StorageHasher.TWOX_64_CONCAT),
                    t.accountAndIndex(),
                    t.bytes()),
                Bytes.empty(),
                List.of())));
  }

  public static RuntimeMetadataV14 v14() {
    Types t = registry();
    io.framemeta.metadata.v14.PalletMetadata balances =
        new io.framemeta.metadata.v14.PalletMetadata(
            "Balances",
            Optional.of(balancesStorage(t)),
            Optional.of(new PalletCallMetadata(t.call())),
            Optional.of(new PalletEventMetadata(t.event())),
            List.of(
                new PalletConstantMetadata(
                    "ExistentialDeposit", t.u128(), Bytes.of(new byte[16]), List.of())),
            Optional.of(new PalletErrorMetadata(t.error())),
            10);
    io.framemeta.metadata.v14.PalletMetadata timestamp =
        new io.framemeta.metadata.v14.PalletMetadata(
            "Timestamp",
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            List.of(),
            Optional.empty(),
            3);
    return new RuntimeMetadataV14(
        t.registry(),
        List.of(balances, timestamp),
        new io.framemeta.metadata.v14.ExtrinsicMetadata(
            t.extrinsic(),
            4,
            List.of(new SignedExtensionMetadata("CheckNonce", t.compactBalance(), t.unit()))),
        t.runtime());
  }

  public static RuntimeMetadataV15 v15() {
    Types t = registry();
    io.framemeta.metadata.v15.PalletMetadata balances =
        new io.framemeta.metadata.v15.PalletMetadata(
            "Balances",
            Optional.of(balancesStorage(t)),
            Optional.of(new PalletCallMetadata(t.call())),
            Optional.of(new PalletEventMetadata(t.event())),
            List.of(),
            Optional.of(new PalletErrorMetadata(t.error())),
            10,
            List.of("The balances pallet."));
    TreeMap<String, CustomValueMetadata> custom = new TreeMap<>();
    custom.put("zeta", new CustomValueMetadata(t.u32(), Bytes.fromHex("01000000")));
    custom.put("alpha", new CustomValueMetadata(t.bool(), Bytes.fromHex("01")));
    return new RuntimeMetadataV15(
        t.registry(),
        List.of(balances),
        new io.framemeta.metadata.v15.ExtrinsicMetadata(
            4,
            t.accountId(),
            t.call(),
            t.bytes(),
            t.unit(),
            List.of(new SignedExtensionMetadata("CheckNonce", t.compactBalance(), t.unit()))),
        t.runtime(),
        List.of(
            new io.framemeta.metadata.v15.RuntimeApiMetadata(
                "AccountNonceApi",
                List.of(
                    new io.framemeta.metadata.v15.RuntimeApiMethodMetadata(
                        "account_nonce",
                        List.of(new RuntimeApiMethodParamMetadata("account", t.accountId())),
                        t.u32(),
                        List.of(" Get the nonce."))),
                List.of())),
        new OuterEnums(t.call(), t.event(), t.error()),
        new CustomMetadata(custom));
  }

  public static RuntimeMetadataV16 v16() {
    Types t = registry();
    io.framemeta.metadata.v16.PalletStorageMetadata storage =
        new io.framemeta.metadata.v16.PalletStorageMetadata(
            "Balances",
            List.of(
                new io.framemeta.metadata.v16.StorageEntryMetadata(
                    "TotalIssuance",
                    StorageEntryModifier.DEFAULT,
                    new io.framemeta.metadata.modern.PlainStorage(t.u128()),
                    Bytes.of(new byte[16]),
                    List.of(),
                    DeprecationStatus.notDeprecated()),
                new io.framemeta.metadata.v16.StorageEntryMetadata(
                    "Locks",
                    StorageEntryModifier.OPTIONAL,
                    new io.framemeta.metadata.modern.MapStorage(
                        List.of(StorageHasher.BLAKE2_128_CONCAT, StorageHasher.TWOX_64_CONCAT),
                        t.accountAndIndex(),
                        t.bytes()),
                    Bytes.empty(),
                    List.of(),
                    new DeprecationStatus.Deprecated("use Freezes", Optional.of("1.2.0")))));
    TreeMap<Integer, DeprecationStatus> deprecatedVariants = new TreeMap<>();
    deprecatedVariants.put(1, new DeprecationStatus.DeprecatedWithoutNote());
    byte[] viewId = new byte[32];
    viewId[0] = 0x42;
    io.framemeta.metadata.v16.PalletMetadata balances =
        new io.framemeta.metadata.v16.PalletMetadata(
            "Balances",
            Optional.of(storage),
            Optional.of(
                new io.framemeta.metadata.v16.PalletCallMetadata(
                    t.call(), new DeprecationInfo.VariantsDeprecated(deprecatedVariants))),
            Optional.of(
                new io.framemeta.metadata.v16.PalletEventMetadata(
                    t.event(), DeprecationInfo.notDeprecated())),
            List.of(
                new io.framemeta.metadata.v16.PalletConstantMetadata(
                    "ExistentialDeposit",
                    t.u128(),
                    Bytes.of(new byte[16]),
                    List.of(),
                    DeprecationStatus.notDeprecated())),
            Optional.of(
                new io.framemeta.metadata.v16.PalletErrorMetadata(
                    t.error(),
                    new DeprecationInfo.ItemDeprecated(
                        new DeprecationStatus.DeprecatedWithoutNote()))),
            List.of(
                new PalletAssociatedTypeMetadata("Balance", t.u128(), List.of("Balance type."))),
            List.of(
                new PalletViewFunctionMetadata(
                    "free_balance",
                    Bytes.of(viewId),
                    List.of(new RuntimeApiMethodParamMetadata("who", t.accountId())),
                    t.u128(),
                    List.of(),
                    DeprecationStatus.notDeprecated())),
            10,
            List.of("The balances pallet."),
            DeprecationStatus.notDeprecated());
    TreeMap<Integer, List<Long>> byVersion = new TreeMap<>();
    byVersion.put(0, List.of(0L, 1L));
    return new RuntimeMetadataV16(
        t.registry(),
        List.of(balances),
        new io.framemeta.metadata.v16.ExtrinsicMetadata(
            List.of(4, 5),
            t.accountId(),
            t.bytes(),
            byVersion,
            List.of(
                new TransactionExtensionMetadata("CheckNonce", t.compactBalance(), t.unit()),
                new TransactionExtensionMetadata("CheckWeight", t.unit(), t.unit()))),
        List.of(
            new io.framemeta.metadata.v16.RuntimeApiMetadata(
                "AccountNonceApi",
                List.of(
                    new io.framemeta.metadata.v16.RuntimeApiMethodMetadata(
                        "account_nonce",
                        List.of(new RuntimeApiMethodParamMetadata("account", t.accountId())),
                        t.u32(),
                        List.of(),
                        DeprecationStatus.notDeprecated())),
                List.of(),
                DeprecationStatus.notDeprecated(),
                1)),
        new OuterEnums(t.call(), t.event(), t.error()),
        CustomMetadata.empty());
  }

  /** The smallest V16 tree: nothing but mandatory type slots, all pointing at id 0. */
  public static RuntimeMetadataV16 emptyV16() {
    TypeId zero = TypeId.of(0);
    return new RuntimeMetadataV16(
        TypeRegistry.empty(),
        List.of(),
        new io.framemeta.metadata.v16.ExtrinsicMetadata(
            List.of(), zero, zero, new TreeMap<>(), List.of()),
        List.of(),
        new OuterEnums(zero, zero, zero),
        CustomMetadata.empty());
  }

  /** Returns a representative tree of every version. */
  public static RuntimeMetadata of(MetadataVersion version) {
    switch (version) {
      case V14:
        return v14();
      case V15:
        return v15();
      case V16:
        return v16();
      default:
        return legacy(version);
    }
  }
}
