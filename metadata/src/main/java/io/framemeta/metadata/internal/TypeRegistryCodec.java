package io.framemeta.metadata.internal;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.types.ArrayDef;
import io.framemeta.metadata.types.BitSequenceDef;
import io.framemeta.metadata.types.CompactDef;
import io.framemeta.metadata.types.CompositeDef;
import io.framemeta.metadata.types.Field;
import io.framemeta.metadata.types.PrimitiveDef;
import io.framemeta.metadata.types.PrimitiveType;
import io.framemeta.metadata.types.RegisteredType;
import io.framemeta.metadata.types.SequenceDef;
import io.framemeta.metadata.types.TupleDef;
import io.framemeta.metadata.types.TypeDef;
import io.framemeta.metadata.types.TypeDescriptor;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeParameter;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.types.Variant;
import io.framemeta.metadata.types.VariantDef;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.List;

/** Reads and writes the portable type registry embedded in V14+ metadata. */
public final class TypeRegistryCodec {
  static final int COMPOSITE = 0;
  static final int VARIANT = 1;
  static final int SEQUENCE = 2;
  static final int ARRAY = 3;
  static final int TUPLE = 4;
  static final int PRIMITIVE = 5;
  static final int COMPACT = 6;
  static final int BIT_SEQUENCE = 7;

  private static final PrimitiveType[] PRIMITIVES = PrimitiveType.values();

  private TypeRegistryCodec() {}

  /** Reads a compact-encoded type id. */
  public static TypeId readTypeId(ScaleReader r) throws ScaleCodecException {
    return new TypeId(r.readCompactInt("type id"));
  }

  public static void writeTypeId(ScaleWriter w, TypeId id) {
    w.writeCompact(id.id());
  }

  /**
   * Reads a registry. Duplicate ids are rejected; dangling references are not checked here.
   *
   * @param r the reader
   * @return the registry
   * @throws ScaleCodecException if the encoding is invalid
   */
  public static TypeRegistry read(ScaleReader r) throws ScaleCodecException {
    IntSet seen = new IntOpenHashSet();
    List<RegisteredType> types =
        r.readList(
            in -> {
              int at = in.position();
              TypeId id = readTypeId(in);
              if (!seen.add(id.id())) {
                throw new ScaleCodecException("duplicate type id " + id.id(), at);
              }
              return new RegisteredType(id, readDescriptor(in));
            });
    return TypeRegistry.of(types);
  }

  public static void write(ScaleWriter w, TypeRegistry registry) {
    w.writeList(
        registry.types(),
        (out, t) -> {
          writeTypeId(out, t.id());
          writeDescriptor(out, t.type());
        });
  }

  private static TypeDescriptor readDescriptor(ScaleReader r) throws ScaleCodecException {
    List<String> path = r.readStrings();
    List<TypeParameter> params =
        r.readList(
            in ->
                new TypeParameter(
                    in.readString(), in.readOptional(TypeRegistryCodec::readTypeId)));
    TypeDef def = readTypeDef(r);
    List<String> docs = r.readStrings();
    return new TypeDescriptor(path, params, def, docs);
  }

  private static void writeDescriptor(ScaleWriter w, TypeDescriptor d) {
    w.writeStrings(d.path());
    w.writeList(
        d.typeParams(),
        (out, p) -> {
          out.writeString(p.name());
          out.writeOptional(p.type(), TypeRegistryCodec::writeTypeId);
        });
    writeTypeDef(w, d.typeDef());
    w.writeStrings(d.docs());
  }

  private static TypeDef readTypeDef(ScaleReader r) throws ScaleCodecException {
    int tag = r.readEnumTag("TypeDef", 8);
    switch (tag) {
      case COMPOSITE:
        return new CompositeDef(r.readList(TypeRegistryCodec::readField));
      case VARIANT:
        return new VariantDef(r.readList(TypeRegistryCodec::readVariant));
      case SEQUENCE:
        return new SequenceDef(readTypeId(r));
      case ARRAY:
        {
          long len = r.readU32();
          return new ArrayDef(len, readTypeId(r));
        }
      case TUPLE:
        return new TupleDef(r.readList(TypeRegistryCodec::readTypeId));
      case PRIMITIVE:
        return new PrimitiveDef(PRIMITIVES[r.readEnumTag("TypeDefPrimitive", PRIMITIVES.length)]);
      case COMPACT:
        return new CompactDef(readTypeId(r));
      default:
        {
          TypeId store = readTypeId(r);
          return new BitSequenceDef(store, readTypeId(r));
        }
    }
  }

  private static void writeTypeDef(ScaleWriter w, TypeDef def) {
    if (def instanceof CompositeDef c) {
      w.writeU8(COMPOSITE).writeList(c.fields(), TypeRegistryCodec::writeField);
    } else if (def instanceof VariantDef v) {
      w.writeU8(VARIANT).writeList(v.variants(), TypeRegistryCodec::writeVariant);
    } else if (def instanceof SequenceDef s) {
      w.writeU8(SEQUENCE);
      writeTypeId(w, s.elementType());
    } else if (def instanceof ArrayDef a) {
      w.writeU8(ARRAY).writeU32(a.length());
      writeTypeId(w, a.elementType());
    } else if (def instanceof TupleDef t) {
      w.writeU8(TUPLE).writeList(t.fields(), TypeRegistryCodec::writeTypeId);
    } else if (def instanceof PrimitiveDef p) {
      w.writeU8(PRIMITIVE).writeU8(p.primitive().ordinal());
    } else if (def instanceof CompactDef c) {
      w.writeU8(COMPACT);
      writeTypeId(w, c.wrappedType());
    } else if (def instanceof BitSequenceDef b) {
      w.writeU8(BIT_SEQUENCE);
      writeTypeId(w, b.bitStoreType());
      writeTypeId(w, b.bitOrderType());
    } else {
      throw new IllegalArgumentException("Unknown type definition: " + def);
    }
  }

  private static Field readField(ScaleReader r) throws ScaleCodecException {
    return new Field(
        r.readOptional(ScaleReader::readString),
        readTypeId(r),
        r.readOptional(ScaleReader::readString),
        r.readStrings());
  }

  private static void writeField(ScaleWriter w, Field f) {
    w.writeOptional(f.name(), ScaleWriter::writeString);
    writeTypeId(w, f.type());
    w.writeOptional(f.typeName(), ScaleWriter::writeString);
    w.writeStrings(f.docs());
  }

  private static Variant readVariant(ScaleReader r) throws ScaleCodecException {
    String name = r.readString();
    List<Field> fields = r.readList(TypeRegistryCodec::readField);
    int index = r.readU8();
    return new Variant(name, fields, index, r.readStrings());
  }

  private static void writeVariant(ScaleWriter w, Variant v) {
    w.writeString(v.name());
    w.writeList(v.fields(), TypeRegistryCodec::writeField);
    w.writeU8(v.index());
    w.writeStrings(v.docs());
  }
}
