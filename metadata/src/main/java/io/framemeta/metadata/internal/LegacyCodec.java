package io.framemeta.metadata.internal;

import io.framemeta.codec.Bytes;
import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataV10;
import io.framemeta.metadata.api.RuntimeMetadataV11;
import io.framemeta.metadata.api.RuntimeMetadataV12;
import io.framemeta.metadata.api.RuntimeMetadataV13;
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
import io.framemeta.metadata.legacy.StorageEntryType;
import io.framemeta.metadata.legacy.StorageKey;
import io.framemeta.metadata.legacy.StorageMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Payload codec for the legacy versions V8-V13, which share one layout that grew by a few fields
 * and variants over time:
 *
 * <ul>
 *   <li>V10 inserts the {@code Blake2_128Concat} hasher, V11 appends {@code Identity}
 *   <li>V11 adds the extrinsic after the module list
 *   <li>V12 adds the module index after each module
 *   <li>V13 adds the NMap storage variant
 * </ul>
 *
 * <p>DoubleMap entries store the second key's hasher after the value on the wire; in the model it
 * is the second element of the key list.
 *
 * @param <T> the tree type of the version
 */
public final class LegacyCodec<T extends RuntimeMetadata> implements PayloadCodec<T> {
  public static final LegacyCodec<RuntimeMetadataV8> V8 =
      new LegacyCodec<>(
          MetadataVersion.V8,
          (m, x) -> new RuntimeMetadataV8(m),
          RuntimeMetadataV8::modules,
          t -> null);
  public static final LegacyCodec<RuntimeMetadataV9> V9 =
      new LegacyCodec<>(
          MetadataVersion.V9,
          (m, x) -> new RuntimeMetadataV9(m),
          RuntimeMetadataV9::modules,
          t -> null);
  public static final LegacyCodec<RuntimeMetadataV10> V10 =
      new LegacyCodec<>(
          MetadataVersion.V10,
          (m, x) -> new RuntimeMetadataV10(m),
          RuntimeMetadataV10::modules,
          t -> null);
  public static final LegacyCodec<RuntimeMetadataV11> V11 =
      new LegacyCodec<>(
          MetadataVersion.V11,
          RuntimeMetadataV11::new,
          RuntimeMetadataV11::modules,
          RuntimeMetadataV11::extrinsic);
  public static final LegacyCodec<RuntimeMetadataV12> V12 =
      new LegacyCodec<>(
          MetadataVersion.V12,
          RuntimeMetadataV12::new,
          RuntimeMetadataV12::modules,
          RuntimeMetadataV12::extrinsic);
  public static final LegacyCodec<RuntimeMetadataV13> V13 =
      new LegacyCodec<>(
          MetadataVersion.V13,
          RuntimeMetadataV13::new,
          RuntimeMetadataV13::modules,
          RuntimeMetadataV13::extrinsic);

  private static final int PLAIN = 0;
  private static final int MAP = 1;
  private static final int DOUBLE_MAP = 2;
  private static final int N_MAP = 3;

  private static final StorageEntryModifier[] MODIFIERS = StorageEntryModifier.values();

  private final MetadataVersion version;
  private final BiFunction<List<ModuleMetadata>, ExtrinsicMetadata, T> factory;
  private final Function<T, List<ModuleMetadata>> modules;
  private final Function<T, ExtrinsicMetadata> extrinsic;
  private final List<StorageHasher> hashers;
  private final boolean hasExtrinsic;
  private final boolean hasIndex;
  private final int storageVariants;

  private LegacyCodec(
      MetadataVersion version,
      BiFunction<List<ModuleMetadata>, ExtrinsicMetadata, T> factory,
      Function<T, List<ModuleMetadata>> modules,
      Function<T, ExtrinsicMetadata> extrinsic) {
    this.version = version;
    this.factory = factory;
    this.modules = modules;
    this.extrinsic = extrinsic;
    this.hashers = StorageHasher.wireTable(version);
    this.hasExtrinsic = !version.isBefore(MetadataVersion.V11);
    this.hasIndex = !version.isBefore(MetadataVersion.V12);
    this.storageVariants = version == MetadataVersion.V13 ? 4 : 3;
  }

  @Override
  public MetadataVersion version() {
    return version;
  }

  @Override
  public T decode(ScaleReader r) throws ScaleCodecException {
    List<ModuleMetadata> mods = r.readList(this::readModule);
    ExtrinsicMetadata x = null;
    if (hasExtrinsic) {
      int xv = r.readU8();
      x = new ExtrinsicMetadata(xv, r.readStrings());
    }
    return factory.apply(mods, x);
  }

  @Override
  public void encode(ScaleWriter w, T metadata) {
    w.writeList(modules.apply(metadata), this::writeModule);
    if (hasExtrinsic) {
      ExtrinsicMetadata x = extrinsic.apply(metadata);
      w.writeU8(x.version()).writeStrings(x.signedExtensions());
    }
  }

  private ModuleMetadata readModule(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    Optional<StorageMetadata> storage = r.readOptional(this::readStorage);
    Optional<List<FunctionMetadata>> calls =
        r.readOptional(in -> in.readList(LegacyCodec::readFunction));
    Optional<List<EventMetadata>> events =
        r.readOptional(in -> in.readList(LegacyCodec::readEvent));
    List<ModuleConstantMetadata> constants = r.readList(LegacyCodec::readConstant);
    List<ErrorMetadata> errors =
        r.readList(in -> new ErrorMetadata(in.readString(), in.readStrings()));
    OptionalInt index = hasIndex ? OptionalInt.of(r.readU8()) : OptionalInt.empty();
    return new ModuleMetadata(name, storage, calls, events, constants, errors, index);
  }

  private void writeModule(ScaleWriter w, ModuleMetadata m) {
    w.writeString(m.name());
    w.writeOptional(m.storage(), this::writeStorage);
    w.writeOptional(m.calls(), (out, calls) -> out.writeList(calls, LegacyCodec::writeFunction));
    w.writeOptional(m.events(), (out, events) -> out.writeList(events, LegacyCodec::writeEvent));
    w.writeList(m.constants(), LegacyCodec::writeConstant);
    w.writeList(m.errors(), (out, e) -> out.writeString(e.name()).writeStrings(e.docs()));
    if (hasIndex) {
      w.writeU8(m.index().orElseThrow());
    }
  }

  private StorageMetadata readStorage(ScaleReader r) throws ScaleCodecException {
    String prefix = r.readString();
    return new StorageMetadata(prefix, r.readList(this::readEntry));
  }

  private void writeStorage(ScaleWriter w, StorageMetadata s) {
    w.writeString(s.prefix()).writeList(s.entries(), this::writeEntry);
  }

  private StorageEntryMetadata readEntry(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    StorageEntryModifier modifier = MODIFIERS[r.readEnumTag("StorageEntryModifier", 2)];
    StorageEntryType type = readEntryType(r);
    Bytes defaultValue = r.readBytes();
    return new StorageEntryMetadata(name, modifier, type, defaultValue, r.readStrings());
  }

  private void writeEntry(ScaleWriter w, StorageEntryMetadata e) {
    w.writeString(e.name()).writeU8(e.modifier().ordinal());
    writeEntryType(w, e.type());
    w.writeBytes(e.defaultValue()).writeStrings(e.docs());
  }

  private StorageHasher readHasher(ScaleReader r) throws ScaleCodecException {
    return hashers.get(r.readEnumTag("StorageHasher", hashers.size()));
  }

  private void writeHasher(ScaleWriter w, StorageHasher h) {
    w.writeU8(h.wireIndex(version));
  }

  private StorageEntryType readEntryType(ScaleReader r) throws ScaleCodecException {
    switch (r.readEnumTag("StorageEntryType", storageVariants)) {
      case PLAIN:
        return new PlainStorage(r.readString());
      case MAP:
        {
          StorageHasher hasher = readHasher(r);
          String key = r.readString();
          String value = r.readString();
          boolean unused = r.readBool();
          return new MapStorage(List.of(new StorageKey(hasher, key)), value, MapShape.MAP, unused);
        }
      case DOUBLE_MAP:
        {
          StorageHasher hasher = readHasher(r);
          String key1 = r.readString();
          String key2 = r.readString();
          String value = r.readString();
          StorageHasher key2Hasher = readHasher(r);
          return MapStorage.doubleMap(hasher, key1, key2Hasher, key2, value);
        }
      default:
        {
          int at = r.position();
          List<String> keys = r.readStrings();
          List<StorageHasher> nHashers = r.readList(this::readHasher);
          if (keys.size() != nHashers.size()) {
            throw new ScaleCodecException(
                "NMap has " + keys.size() + " keys but " + nHashers.size() + " hashers", at);
          }
          List<StorageKey> storageKeys = new ArrayList<>(keys.size());
          for (int i = 0; i < keys.size(); i++) {
            storageKeys.add(new StorageKey(nHashers.get(i), keys.get(i)));
          }
          return MapStorage.nMap(storageKeys, r.readString());
        }
    }
  }

  private void writeEntryType(ScaleWriter w, StorageEntryType type) {
    if (type instanceof MapStorage map) {
      List<StorageKey> keys = map.keys();
      switch (map.shape()) {
        case MAP -> {
          w.writeU8(MAP);
          writeHasher(w, keys.get(0).hasher());
          w.writeString(keys.get(0).keyType()).writeString(map.valueType()).writeBool(map.unused());
        }
        case DOUBLE_MAP -> {
          w.writeU8(DOUBLE_MAP);
          writeHasher(w, keys.get(0).hasher());
          w.writeString(keys.get(0).keyType())
              .writeString(keys.get(1).keyType())
              .writeString(map.valueType());
          writeHasher(w, keys.get(1).hasher());
        }
        case N_MAP -> {
          w.writeU8(N_MAP);
          w.writeList(keys, (out, k) -> out.writeString(k.keyType()));
          w.writeList(map.hashers(), this::writeHasher);
          w.writeString(map.valueType());
        }
      }
    } else {
      w.writeU8(PLAIN).writeString(type.valueType());
    }
  }

  private static FunctionMetadata readFunction(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<FunctionArgument> args =
        r.readList(in -> new FunctionArgument(in.readString(), in.readString()));
    return new FunctionMetadata(name, args, r.readStrings());
  }

  private static void writeFunction(ScaleWriter w, FunctionMetadata f) {
    w.writeString(f.name());
    w.writeList(f.arguments(), (out, a) -> out.writeString(a.name()).writeString(a.type()));
    w.writeStrings(f.docs());
  }

  private static EventMetadata readEvent(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<String> args = r.readStrings();
    return new EventMetadata(name, args, r.readStrings());
  }

  private static void writeEvent(ScaleWriter w, EventMetadata e) {
    w.writeString(e.name()).writeStrings(e.arguments()).writeStrings(e.docs());
  }

  private static ModuleConstantMetadata readConstant(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    String type = r.readString();
    Bytes value = r.readBytes();
    return new ModuleConstantMetadata(name, type, value, r.readStrings());
  }

  private static void writeConstant(ScaleWriter w, ModuleConstantMetadata c) {
    w.writeString(c.name()).writeString(c.type()).writeBytes(c.value()).writeStrings(c.docs());
  }
}
