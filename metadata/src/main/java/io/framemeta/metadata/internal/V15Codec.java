package io.framemeta.metadata.internal;

import static io.framemeta.metadata.internal.TypeRegistryCodec.readTypeId;
import static io.framemeta.metadata.internal.TypeRegistryCodec.writeTypeId;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadataV15;
import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.ExtrinsicMetadata;
import io.framemeta.metadata.v15.OuterEnums;
import io.framemeta.metadata.v15.PalletMetadata;
import io.framemeta.metadata.v15.RuntimeApiMetadata;
import io.framemeta.metadata.v15.RuntimeApiMethodMetadata;
import io.framemeta.metadata.v15.RuntimeApiMethodParamMetadata;
import java.util.List;
import java.util.Optional;

/** Payload codec for V15 metadata. */
public final class V15Codec implements PayloadCodec<RuntimeMetadataV15> {
  public static final V15Codec INSTANCE = new V15Codec();

  private V15Codec() {}

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V15;
  }

  @Override
  public RuntimeMetadataV15 decode(ScaleReader r) throws ScaleCodecException {
    TypeRegistry types = TypeRegistryCodec.read(r);
    List<PalletMetadata> pallets = r.readList(V15Codec::readPallet);
    ExtrinsicMetadata extrinsic = readExtrinsic(r);
    TypeId runtimeType = readTypeId(r);
    List<RuntimeApiMetadata> apis = r.readList(V15Codec::readApi);
    OuterEnums outerEnums = ModernCodec.readOuterEnums(r);
    CustomMetadata custom = ModernCodec.readCustom(r);
    return new RuntimeMetadataV15(types, pallets, extrinsic, runtimeType, apis, outerEnums, custom);
  }

  @Override
  public void encode(ScaleWriter w, RuntimeMetadataV15 m) {
    TypeRegistryCodec.write(w, m.types());
    w.writeList(m.pallets(), V15Codec::writePallet);
    writeExtrinsic(w, m.extrinsic());
    writeTypeId(w, m.runtimeType());
    w.writeList(m.apis(), V15Codec::writeApi);
    ModernCodec.writeOuterEnums(w, m.outerEnums());
    ModernCodec.writeCustom(w, m.custom());
  }

  private static PalletMetadata readPallet(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    Optional<PalletStorageMetadata> storage = r.readOptional(ModernCodec::readStorage);
    Optional<PalletCallMetadata> calls = r.readOptional(ModernCodec::readCalls);
    Optional<PalletEventMetadata> event = r.readOptional(ModernCodec::readEvent);
    List<PalletConstantMetadata> constants = r.readList(ModernCodec::readConstant);
    Optional<PalletErrorMetadata> error = r.readOptional(ModernCodec::readError);
    int index = r.readU8();
    return new PalletMetadata(
        name, storage, calls, event, constants, error, index, r.readStrings());
  }

  private static void writePallet(ScaleWriter w, PalletMetadata p) {
    w.writeString(p.name());
    w.writeOptional(p.storage(), ModernCodec::writeStorage);
    w.writeOptional(p.calls(), (out, c) -> writeTypeId(out, c.type()));
    w.writeOptional(p.event(), (out, e) -> writeTypeId(out, e.type()));
    w.writeList(p.constants(), ModernCodec::writeConstant);
    w.writeOptional(p.error(), (out, e) -> writeTypeId(out, e.type()));
    w.writeU8(p.index());
    w.writeStrings(p.docs());
  }

  private static ExtrinsicMetadata readExtrinsic(ScaleReader r) throws ScaleCodecException {
    int version = r.readU8();
    TypeId address = readTypeId(r);
    TypeId call = readTypeId(r);
    TypeId signature = readTypeId(r);
    TypeId extra = readTypeId(r);
    return new ExtrinsicMetadata(
        version,
        address,
        call,
        signature,
        extra,
        r.readList(ModernCodec::readSignedExtension));
  }

  private static void writeExtrinsic(ScaleWriter w, ExtrinsicMetadata e) {
    w.writeU8(e.version());
    writeTypeId(w, e.addressType());
    writeTypeId(w, e.callType());
    writeTypeId(w, e.signatureType());
    writeTypeId(w, e.extraType());
    w.writeList(e.signedExtensions(), ModernCodec::writeSignedExtension);
  }

  private static RuntimeApiMetadata readApi(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<RuntimeApiMethodMetadata> methods = r.readList(V15Codec::readMethod);
    return new RuntimeApiMetadata(name, methods, r.readStrings());
  }

  private static void writeApi(ScaleWriter w, RuntimeApiMetadata api) {
    w.writeString(api.name());
    w.writeList(api.methods(), V15Codec::writeMethod);
    w.writeStrings(api.docs());
  }

  private static RuntimeApiMethodMetadata readMethod(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<RuntimeApiMethodParamMetadata> inputs = r.readList(ModernCodec::readParam);
    TypeId output = readTypeId(r);
    return new RuntimeApiMethodMetadata(name, inputs, output, r.readStrings());
  }

  private static void writeMethod(ScaleWriter w, RuntimeApiMethodMetadata m) {
    w.writeString(m.name());
    w.writeList(m.inputs(), ModernCodec::writeParam);
    writeTypeId(w, m.output());
    w.writeStrings(m.docs());
  }
}
