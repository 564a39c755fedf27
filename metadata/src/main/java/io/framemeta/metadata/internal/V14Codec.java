package io.framemeta.metadata.internal;

import static io.framemeta.metadata.internal.TypeRegistryCodec.readTypeId;
import static io.framemeta.metadata.internal.TypeRegistryCodec.writeTypeId;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadataV14;
import io.framemeta.metadata.modern.PalletCallMetadata;
import io.framemeta.metadata.modern.PalletConstantMetadata;
import io.framemeta.metadata.modern.PalletErrorMetadata;
import io.framemeta.metadata.modern.PalletEventMetadata;
import io.framemeta.metadata.modern.PalletStorageMetadata;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.v14.ExtrinsicMetadata;
import io.framemeta.metadata.v14.PalletMetadata;
import java.util.List;
import java.util.Optional;

/** Payload codec for V14 metadata. */
public final class V14Codec implements PayloadCodec<RuntimeMetadataV14> {
  public static final V14Codec INSTANCE = new V14Codec();

  private V14Codec() {}

  @Override
  public MetadataVersion version() {
    return MetadataVersion.V14;
  }

  @Override
  public RuntimeMetadataV14 decode(ScaleReader r) throws ScaleCodecException {
    TypeRegistry types = TypeRegistryCodec.read(r);
    List<PalletMetadata> pallets = r.readList(V14Codec::readPallet);
    ExtrinsicMetadata extrinsic = readExtrinsic(r);
    return new RuntimeMetadataV14(types, pallets, extrinsic, readTypeId(r));
  }

  @Override
  public void encode(ScaleWriter w, RuntimeMetadataV14 m) {
    TypeRegistryCodec.write(w, m.types());
    w.writeList(m.pallets(), V14Codec::writePallet);
    writeTypeId(w, m.extrinsic().type());
    w.writeU8(m.extrinsic().version());
    w.writeList(m.extrinsic().signedExtensions(), ModernCodec::writeSignedExtension);
    writeTypeId(w, m.runtimeType());
  }

  private static PalletMetadata readPallet(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    Optional<PalletStorageMetadata> storage = r.readOptional(ModernCodec::readStorage);
    Optional<PalletCallMetadata> calls = r.readOptional(ModernCodec::readCalls);
    Optional<PalletEventMetadata> event = r.readOptional(ModernCodec::readEvent);
    List<PalletConstantMetadata> constants = r.readList(ModernCodec::readConstant);
    Optional<PalletErrorMetadata> error = r.readOptional(ModernCodec::readError);
    return new PalletMetadata(name, storage, calls, event, constants, error, r.readU8());
  }

  private static void writePallet(ScaleWriter w, PalletMetadata p) {
    w.writeString(p.name());
    w.writeOptional(p.storage(), ModernCodec::writeStorage);
    w.writeOptional(p.calls(), (out, c) -> writeTypeId(out, c.type()));
    w.writeOptional(p.event(), (out, e) -> writeTypeId(out, e.type()));
    w.writeList(p.constants(), ModernCodec::writeConstant);
    w.writeOptional(p.error(), (out, e) -> writeTypeId(out, e.type()));
    w.writeU8(p.index());
  }

  private static ExtrinsicMetadata readExtrinsic(ScaleReader r) throws ScaleCodecException {
    TypeId type = readTypeId(r);
    int version = r.readU8();
    return new ExtrinsicMetadata(type, version, r.readList(ModernCodec::readSignedExtension));
  }
}
