package io.framemeta.metadata.internal;

import static org.junit.jupiter.api.Assertions.*;

import io.framemeta.codec.Bytes;
import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.fixtures.MetadataFixtures;
import io.framemeta.metadata.types.ArrayDef;
import io.framemeta.metadata.types.PrimitiveType;
import io.framemeta.metadata.types.RegisteredType;
import io.framemeta.metadata.types.SequenceDef;
import io.framemeta.metadata.types.TypeDescriptor;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TypeRegistryCodecTest {

  private static String encode(TypeRegistry registry) {
    ScaleWriter w = new ScaleWriter(64);
    TypeRegistryCodec.write(w, registry);
    return w.toBytes().toHex();
  }

  private static TypeRegistry decode(String hex) throws ScaleCodecException {
    ScaleReader r = ScaleReader.of(Bytes.fromHex(hex).toArray());
    TypeRegistry registry = TypeRegistryCodec.read(r);
    r.expectEnd("registry");
    return registry;
  }

  @Test
  void encodesPrimitiveAndSequence() throws Exception {
    TypeRegistry.Builder b = TypeRegistry.builder();
    TypeId u8 = b.primitive(PrimitiveType.U8);
    b.register(new SequenceDef(u8));
    TypeRegistry registry = b.build();

    String hex =
        "0x08"
            + "00" + "00" + "00" + "0503" + "00" // #0 u8
            + "04" + "00" + "00" + "0200" + "00"; // #1 Vec<#0>
    assertEquals(hex, encode(registry));
    assertEquals(registry, decode(hex));
  }

  @Test
  void typeIdsAreCompact() throws Exception {
    TypeId big = TypeId.of(300);
    TypeRegistry registry =
        TypeRegistry.of(List.of(new RegisteredType(big, TypeDescriptor.of(new ArrayDef(4, big)))));
    // 300 = 0b100101100 -> two-byte mode: (300 << 2) | 1 = 0x04b1
    assertEquals(
        "0x04" + "b104" + "00" + "00" + "03" + "04000000" + "b104" + "00", encode(registry));
  }

  @Test
  void rejectsDuplicateIds() {
    String hex = "0x08" + "00" + "00" + "00" + "0503" + "00" + "00" + "00" + "00" + "0503" + "00";
    ScaleCodecException e = assertThrows(ScaleCodecException.class, () -> decode(hex));
    assertEquals(7, e.getOffset());
  }

  @Test
  void rejectsUnknownTypeDefTag() {
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> decode("0x04" + "00" + "00" + "00" + "08"));
    assertEquals(4, e.getOffset());
  }

  @Test
  void rejectsUnknownPrimitive() {
    assertThrows(
        ScaleCodecException.class, () -> decode("0x04" + "00" + "00" + "00" + "05" + "0f"));
  }

  @Test
  void fixtureRegistryRoundTrips() throws Exception {
    TypeRegistry registry = MetadataFixtures.registry().registry();
    assertEquals(registry, decode(encode(registry)));
  }
}
