package io.framemeta.metadata.internal;

import static io.framemeta.metadata.internal.TypeRegistryCodec.readTypeId;
import static io.framemeta.metadata.internal.TypeRegistryCodec.writeTypeId;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.common.StorageEntryModifier;
import io.framemeta.metadata.common.StorageHasher;
import io.framemeta.metadata.modern.MapStorage;
import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import io.framemeta.metadata.modern.PlainStorage;
import io.framemeta.metadata.modern.SignedExtensionMetadata;
import io.framemeta.metadata.modern.StorageEntryMetadata;
import io.framemeta.metadata.modern.StorageEntryType;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.CustomValueMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Pieces shared by the V14, V15 and V16 payload codecs. */
final class ModernCodec {
  private static final StorageEntryModifier[] MODIFIERS = StorageEntryModifier.values();
  private static final List<StorageHasher> HASHERS = StorageHasher.wireTable(MetadataVersion.V14);

  private ModernCodec() {}

  static StorageEntryModifier readModifier(ScaleReader r) throws ScaleCodecException {
    return MODIFIERS[r.readEnumTag("StorageEntryModifier", MODIFIERS.length)];
  }

  static StorageHasher readHasher(ScaleReader r) throws ScaleCodecException {
    return HASHERS.get(r.readEnumTag("StorageHasher", HASHERS.size()));
  }

  static void writeHasher(ScaleWriter w, StorageHasher h) {
    w.writeU8(h.wireIndex(MetadataVersion.V14));
  }

  static StorageEntryType readStorageEntryType(ScaleReader r) throws ScaleCodecException {
    if (r.readEnumTag("StorageEntryType", 2) == 0) {
      return new PlainStorage(readTypeId(r));
    }
    List<StorageHasher> hashers = r.readList(ModernCodec::readHasher);
    TypeId key = readTypeId(r);
    return new MapStorage(hashers, key, readTypeId(r));
  }

  static void writeStorageEntryType(ScaleWriter w, StorageEntryType type) {
    if (type instanceof MapStorage map) {
      w.writeU8(1).writeList(map.hashers(), ModernCodec::writeHasher);
      writeTypeId(w, map.keyType());
      writeTypeId(w, map.valueType());
    } else {
      w.writeU8(0);
      writeTypeId(w, type.valueType());
    }
  }

  static PalletStorageMetadata readStorage(ScaleReader r) throws ScaleCodecException {
    String prefix = r.readString();
    return new PalletStorageMetadata(prefix, r.readList(ModernCodec::readStorageEntry));
  }

  static void writeStorage(ScaleWriter w, PalletStorageMetadata s) {
    w.writeString(s.prefix()).writeList(s.entries(), ModernCodec::writeStorageEntry);
  }

  private static StorageEntryMetadata readStorageEntry(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    StorageEntryModifier modifier = readModifier(r);
    StorageEntryType type = readStorageEntryType(r);
    return new StorageEntryMetadata(name, modifier, type, r.readBytes(), r.readStrings());
  }

  private static void writeStorageEntry(ScaleWriter w, StorageEntryMetadata e) {
    w.writeString(e.name()).writeU8(e.modifier().ordinal());
    writeStorageEntryType(w, e.type());
    w.writeBytes(e.defaultValue()).writeStrings(e.docs());
  }

  static PalletCallMetadata readCalls(ScaleReader r) throws ScaleCodecException {
    return new PalletCallMetadata(readTypeId(r));
  }

  static PalletEventMetadata readEvent(ScaleReader r) throws ScaleCodecException {
    return new PalletEventMetadata(readTypeId(r));
  }

  static PalletErrorMetadata readError(ScaleReader r) throws ScaleCodecException {
    return new PalletErrorMetadata(readTypeId(r));
  }

  static PalletConstantMetadata readConstant(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    TypeId type = readTypeId(r);
    return new PalletConstantMetadata(name, type, r.readBytes(), r.readStrings());
  }

  static void writeConstant(ScaleWriter w, PalletConstantMetadata c) {
    w.writeString(c.name());
    writeTypeId(w, c.type());
    w.writeBytes(c.value()).writeStrings(c.docs());
  }

  static SignedExtensionMetadata readSignedExtension(ScaleReader r) throws ScaleCodecException {
    String identifier = r.readString();
    TypeId type = readTypeId(r);
    return new SignedExtensionMetadata(identifier, type, readTypeId(r));
  }

  static void writeSignedExtension(ScaleWriter w, SignedExtensionMetadata e) {
    w.writeString(e.identifier());
    writeTypeId(w, e.type());
    writeTypeId(w, e.additionalSigned());
  }

  static RuntimeApiMethodParamMetadata readParam(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    return new RuntimeApiMethodParamMetadata(name, readTypeId(r));
  }

  static void writeParam(ScaleWriter w, RuntimeApiMethodParamMetadata p) {
    w.writeString(p.name());
    writeTypeId(w, p.type());
  }

  static OuterEnums readOuterEnums(ScaleReader r) throws ScaleCodecException {
    TypeId call = readTypeId(r);
    TypeId event = readTypeId(r);
    return new OuterEnums(call, event, readTypeId(r));
  }

  static void writeOuterEnums(ScaleWriter w, OuterEnums e) {
    writeTypeId(w, e.callEnumType());
    writeTypeId(w, e.eventEnumType());
    writeTypeId(w, e.errorEnumType());
  }

  /** Reads the custom value map; keys must arrive in strictly ascending UTF-8 byte order. */
  static CustomMetadata readCustom(ScaleReader r) throws ScaleCodecException {
    int n = r.readLength();
    TreeMap<String, CustomValueMetadata> map = new TreeMap<>(CustomMetadata.KEY_ORDER);
    String last = null;
    for (int i = 0; i < n; i++) {
      int at = r.position();
      String key = r.readString();
      if (last != null && CustomMetadata.KEY_ORDER.compare(last, key) >= 0) {
        throw new ScaleCodecException("custom value keys out of order at '" + key + "'", at);
      }
      last = key;
      TypeId type = readTypeId(r);
      map.put(key, new CustomValueMetadata(type, r.readBytes()));
    }
    return new CustomMetadata(map);
  }

  static void writeCustom(ScaleWriter w, CustomMetadata custom) {
    w.writeCompact(custom.map().size());
    for (Map.Entry<String, CustomValueMetadata> e : custom.map().entrySet()) {
      w.writeString(e.getKey());
      writeTypeId(w, e.getValue().type());
      w.writeBytes(e.getValue().value());
    }
  }
}
