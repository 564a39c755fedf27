package io.framemeta.metadata.internal;

import static io.framemeta.metadata.internal.TypeRegistryCodec.readTypeId;
import static io.framemeta.metadata.internal.TypeRegistryCodec.writeTypeId;

import io.framemeta.codec.Bytes;
import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadataV16;
import io.framemeta.metadata.common.StorageEntryModifier;
import io.framemeta.metadata.modern.StorageEntryType;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import io.framemeta.metadata.v16.DeprecationInfo;
import io.framemeta.metadata.v16.DeprecationStatus;
import io.framemeta.metadata.v16.ExtrinsicMetadata;
import io.framemeta.metadata.v16.PalletAssociatedTypeMetadata;
import io.framemeta.metadata.v16.PalletCallMetadata;
import io.framemeta.metadata.v16.PalletConstantMetadata;
import io.framemeta.metadata.v16.PalletErrorMetadata;
import io.framemeta.metadata.v16.PalletEventMetadata;
import io.framemeta.metadata.v16.PalletMetadata;
import io.framemeta.metadata.v16.PalletStorageMetadata;
import io.framemeta.metadata.v16.PalletViewFunctionMetadata;
import io.framemeta.metadata.v16.RuntimeApiMetadata;
import io.framemeta.metadata.v16.RuntimeApiMethodMetadata;
import io.framemeta.metadata.v16.StorageEntryMetadata;
import io.framemeta.metadata.v16.TransactionExtensionMetadata;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Payload codec for V16 metadata. */
public final class V16Codec implements PayloadCodec<RuntimeMetadataV16> {
  public static final V16Codec INSTANCE = new V16Codec();

  private static final int NOT_DEPRECATED = 0;
  private static final int DEPRECATED_WITHOUT_NOTE = 1;
  private static final int DEPRECATED = 2;
  private static final int ITEM_DEPRECATED = 1;
  private static final int VARIANTS_DEPRECATED = 2;

  private V16Codec() {}

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V16;
  }

  @Override
  public RuntimeMetadataV16 decode(ScaleReader r) throws ScaleCodecException {
    TypeRegistry types = TypeRegistryCodec.read(r);
    List<PalletMetadata> pallets = r.readList(V16Codec::readPallet);
    ExtrinsicMetadata extrinsic = readExtrinsic(r);
    List<RuntimeApiMetadata> apis = r.readList(V16Codec::readApi);
    OuterEnums outerEnums = ModernCodec.readOuterEnums(r);
    CustomMetadata custom = ModernCodec.readCustom(r);
    return new RuntimeMetadataV16(types, pallets, extrinsic, apis, outerEnums, custom);
  }

  @Override
  public void encode(ScaleWriter w, RuntimeMetadataV16 m) {
    TypeRegistryCodec.write(w, m.types());
    w.writeList(m.pallets(), V16Codec::writePallet);
    writeExtrinsic(w, m.extrinsic());
    w.writeList(m.apis(), V16Codec::writeApi);
    ModernCodec.writeOuterEnums(w, m.outerEnums());
    ModernCodec.writeCustom(w, m.custom());
  }

  // deprecation

  static DeprecationStatus readStatus(ScaleReader r) throws ScaleCodecException {
    switch (r.readEnumTag("DeprecationStatus", 3)) {
      case NOT_DEPRECATED:
        return DeprecationStatus.notDeprecated();
      case DEPRECATED_WITHOUT_NOTE:
        return new DeprecationStatus.DeprecatedWithoutNote();
      default:
        {
          String note = r.readString();
          return new DeprecationStatus.Deprecated(note, r.readOptional(ScaleReader::readString));
        }
    }
  }

  static void writeStatus(ScaleWriter w, DeprecationStatus status) {
    if (status instanceof DeprecationStatus.Deprecated d) {
      w.writeU8(DEPRECATED).writeString(d.note());
      w.writeOptional(d.since(), ScaleWriter::writeString);
    } else if (status instanceof DeprecationStatus.DeprecatedWithoutNote) {
      w.writeU8(DEPRECATED_WITHOUT_NOTE);
    } else {
      w.writeU8(NOT_DEPRECATED);
    }
  }

  static DeprecationInfo readInfo(ScaleReader r) throws ScaleCodecException {
    switch (r.readEnumTag("DeprecationInfo", 3)) {
      case NOT_DEPRECATED:
        return DeprecationInfo.notDeprecated();
      case ITEM_DEPRECATED:
        return new DeprecationInfo.ItemDeprecated(readStatus(r));
      default:
        {
          int n = r.readLength();
          TreeMap<Integer, DeprecationStatus> variants = new TreeMap<>();
          int last = -1;
          for (int i = 0; i < n; i++) {
            int at = r.position();
            int idx = r.readU8();
            if (idx <= last) {
              throw new ScaleCodecException("deprecated variant indices out of order", at);
            }
            last = idx;
            variants.put(idx, readStatus(r));
          }
          return new DeprecationInfo.VariantsDeprecated(variants);
        }
    }
  }

  static void writeInfo(ScaleWriter w, DeprecationInfo info) {
    if (info instanceof DeprecationInfo.ItemDeprecated item) {
      w.writeU8(ITEM_DEPRECATED);
      writeStatus(w, item.status());
    } else if (info instanceof DeprecationInfo.VariantsDeprecated v) {
      w.writeU8(VARIANTS_DEPRECATED).writeCompact(v.variants().size());
      for (Map.Entry<Integer, DeprecationStatus> e : v.variants().entrySet()) {
        w.writeU8(e.getKey());
        writeStatus(w, e.getValue());
      }
    } else {
      w.writeU8(NOT_DEPRECATED);
    }
  }

  // pallets

  private static PalletMetadata readPallet(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    Optional<PalletStorageMetadata> storage = r.readOptional(V16Codec::readStorage);
    Optional<PalletCallMetadata> calls =
        r.readOptional(in -> new PalletCallMetadata(readTypeId(in), readInfo(in)));
    Optional<PalletEventMetadata> event =
        r.readOptional(in -> new PalletEventMetadata(readTypeId(in), readInfo(in)));
    List<PalletConstantMetadata> constants = r.readList(V16Codec::readConstant);
    Optional<PalletErrorMetadata> error =
        r.readOptional(in -> new PalletErrorMetadata(readTypeId(in), readInfo(in)));
    List<PalletAssociatedTypeMetadata> associated = r.readList(V16Codec::readAssociatedType);
    List<PalletViewFunctionMetadata> views = r.readList(V16Codec::readViewFunction);
    int index = r.readU8();
    List<String> docs = r.readStrings();
    return new PalletMetadata(
        name,
        storage,
        calls,
        event,
        constants,
        error,
        associated,
        views,
        index,
        docs,
        readStatus(r));
  }

  private static void writePallet(ScaleWriter w, PalletMetadata p) {
    w.writeString(p.name());
    w.writeOptional(p.storage(), V16Codec::writeStorage);
    w.writeOptional(
        p.calls(),
        (out, c) -> {
          writeTypeId(out, c.type());
          writeInfo(out, c.deprecation());
        });
    w.writeOptional(
        p.event(),
        (out, e) -> {
          writeTypeId(out, e.type());
          writeInfo(out, e.deprecation());
        });
    w.writeList(p.constants(), V16Codec::writeConstant);
    w.writeOptional(
        p.error(),
        (out, e) -> {
          writeTypeId(out, e.type());
          writeInfo(out, e.deprecation());
        });
    w.writeList(p.associatedTypes(), V16Codec::writeAssociatedType);
    w.writeList(p.viewFunctions(), V16Codec::writeViewFunction);
    w.writeU8(p.index());
    w.writeStrings(p.docs());
    writeStatus(w, p.deprecation());
  }

  private static PalletStorageMetadata readStorage(ScaleReader r) throws ScaleCodecException {
    String prefix = r.readString();
    return new PalletStorageMetadata(prefix, r.readList(V16Codec::readStorageEntry));
  }

  private static void writeStorage(ScaleWriter w, PalletStorageMetadata s) {
    w.writeString(s.prefix()).writeList(s.entries(), V16Codec::writeStorageEntry);
  }

  private static StorageEntryMetadata readStorageEntry(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    StorageEntryModifier modifier = ModernCodec.readModifier(r);
    StorageEntryType type = ModernCodec.readStorageEntryType(r);
    Bytes defaultValue = r.readBytes();
    List<String> docs = r.readStrings();
    return new StorageEntryMetadata(name, modifier, type, defaultValue, docs, readStatus(r));
  }

  private static void writeStorageEntry(ScaleWriter w, StorageEntryMetadata e) {
    w.writeString(e.name()).writeU8(e.modifier().ordinal());
    ModernCodec.writeStorageEntryType(w, e.type());
    w.writeBytes(e.defaultValue()).writeStrings(e.docs());
    writeStatus(w, e.deprecation());
  }

  private static PalletConstantMetadata readConstant(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    TypeId type = readTypeId(r);
    Bytes value = r.readBytes();
    List<String> docs = r.readStrings();
    return new PalletConstantMetadata(name, type, value, docs, readStatus(r));
  }

  private static void writeConstant(ScaleWriter w, PalletConstantMetadata c) {
    w.writeString(c.name());
    writeTypeId(w, c.type());
    w.writeBytes(c.value()).writeStrings(c.docs());
    writeStatus(w, c.deprecation());
  }

  private static PalletAssociatedTypeMetadata readAssociatedType(ScaleReader r)
      throws ScaleCodecException {
    String name = r.readString();
    TypeId type = readTypeId(r);
    return new PalletAssociatedTypeMetadata(name, type, r.readStrings());
  }

  private static void writeAssociatedType(ScaleWriter w, PalletAssociatedTypeMetadata a) {
    w.writeString(a.name());
    writeTypeId(w, a.type());
    w.writeStrings(a.docs());
  }

  private static PalletViewFunctionMetadata readViewFunction(ScaleReader r)
      throws ScaleCodecException {
    String name = r.readString();
    Bytes id = r.readFixed(PalletViewFunctionMetadata.ID_LENGTH);
    List<RuntimeApiMethodParamMetadata> inputs = r.readList(ModernCodec::readParam);
    TypeId output = readTypeId(r);
    List<String> docs = r.readStrings();
    return new PalletViewFunctionMetadata(name, id, inputs, output, docs, readStatus(r));
  }

  private static void writeViewFunction(ScaleWriter w, PalletViewFunctionMetadata f) {
    w.writeString(f.name()).writeFixed(f.id());
    w.writeList(f.inputs(), ModernCodec::writeParam);
    writeTypeId(w, f.output());
    w.writeStrings(f.docs());
    writeStatus(w, f.deprecation());
  }

  // extrinsic

  private static ExtrinsicMetadata readExtrinsic(ScaleReader r) throws ScaleCodecException {
    List<Integer> versions = r.readList(ScaleReader::readU8);
    TypeId address = readTypeId(r);
    TypeId signature = readTypeId(r);
    int n = r.readLength();
    TreeMap<Integer, List<Long>> byVersion = new TreeMap<>();
    int last = -1;
    for (int i = 0; i < n; i++) {
      int at = r.position();
      int version = r.readU8();
      if (version <= last) {
        throw new ScaleCodecException("extension versions out of order", at);
      }
      last = version;
      byVersion.put(version, r.readList(ScaleReader::readCompactU32));
    }
    List<TransactionExtensionMetadata> extensions = r.readList(V16Codec::readExtension);
    return new ExtrinsicMetadata(versions, address, signature, byVersion, extensions);
  }

  private static void writeExtrinsic(ScaleWriter w, ExtrinsicMetadata e) {
    w.writeList(e.versions(), ScaleWriter::writeU8);
    writeTypeId(w, e.addressType());
    writeTypeId(w, e.signatureType());
    w.writeCompact(e.transactionExtensionsByVersion().size());
    for (Map.Entry<Integer, List<Long>> entry : e.transactionExtensionsByVersion().entrySet()) {
      w.writeU8(entry.getKey());
      w.writeList(entry.getValue(), ScaleWriter::writeCompact);
    }
    w.writeList(e.transactionExtensions(), V16Codec::writeExtension);
  }

  private static TransactionExtensionMetadata readExtension(ScaleReader r)
      throws ScaleCodecException {
    String identifier = r.readString();
    TypeId type = readTypeId(r);
    return new TransactionExtensionMetadata(identifier, type, readTypeId(r));
  }

  private static void writeExtension(ScaleWriter w, TransactionExtensionMetadata e) {
    w.writeString(e.identifier());
    writeTypeId(w, e.type());
    writeTypeId(w, e.implicit());
  }

  // runtime APIs

  private static RuntimeApiMetadata readApi(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<RuntimeApiMethodMetadata> methods = r.readList(V16Codec::readMethod);
    List<String> docs = r.readStrings();
    DeprecationStatus deprecation = readStatus(r);
    return new RuntimeApiMetadata(name, methods, docs, deprecation, r.readCompactU32());
  }

  private static void writeApi(ScaleWriter w, RuntimeApiMetadata api) {
    w.writeString(api.name());
    w.writeList(api.methods(), V16Codec::writeMethod);
    w.writeStrings(api.docs());
    writeStatus(w, api.deprecation());
    w.writeCompact(api.version());
  }

  private static RuntimeApiMethodMetadata readMethod(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<RuntimeApiMethodParamMetadata> inputs = r.readList(ModernCodec::readParam);
    TypeId output = readTypeId(r);
    List<String> docs = r.readStrings();
    return new RuntimeApiMethodMetadata(name, inputs, output, docs, readStatus(r));
  }

  private static void writeMethod(ScaleWriter w, RuntimeApiMethodMetadata m) {
    w.writeString(m.name());
    w.writeList(m.inputs(), ModernCodec::writeParam);
    writeTypeId(w, m.output());
    w.writeStrings(m.docs());
    writeStatus(w, m.deprecation());
  }
}
