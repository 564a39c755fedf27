package io.framemeta.metadata.api;

import static org.junit.jupiter.api.Assertions.*;

import io.framemeta.codec.Bytes;
import io.framemeta.metadata.fixtures.MetadataFixtures;
import io.framemeta.metadata.legacy.ModuleMetadata;
import io.framemeta.metadata.modern.PlainStorage;
import io.framemeta.metadata.modern.StorageEntryMetadata;
import io.framemeta.metadata.types.PrimitiveDef;
import io.framemeta.metadata.types.PrimitiveType;
import io.framemeta.metadata.types.TypeDescriptor;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

public class RuntimeMetadataCodecTest {
  private final RuntimeMetadataCodec codec =
      new RuntimeMetadataCodec(MetadataOptions.builder().build());

  @ParameterizedTest
  @EnumSource(MetadataVersion.class)
  void roundTripsEveryVersion(MetadataVersion version) throws Exception {
    RuntimeMetadata original = MetadataFixtures.of(version);
    byte[] encoded = codec.encode(original);

    assertEquals(version.tag(), RuntimeMetadataCodec.versionOf(encoded));
    RuntimeMetadata decoded = codec.decode(encoded);
    assertEquals(version, decoded.version());
    assertEquals(original, decoded);
    assertArrayEquals(encoded, codec.encode(decoded));
  }

  @ParameterizedTest
  @EnumSource(
      value = MetadataVersion.class,
      names = {"V8", "V9", "V10"})
  void roundTripsEmptyModuleList(MetadataVersion version) throws Exception {
    RuntimeMetadata empty =
        switch (version) {
          case V8 -> new RuntimeMetadataV8(List.of());
          case V9 -> new RuntimeMetadataV9(List.of());
          default -> new RuntimeMetadataV10(List.of());
        };
    byte[] encoded = codec.encode(empty);
    assertEquals(6, encoded.length);
    assertEquals(empty, codec.decode(encoded));
  }

  @Test
  void writesMagicAndTag() {
    byte[] encoded = codec.encode(new RuntimeMetadataV9(List.of()));
    assertEquals("0x6d6574610900", Bytes.of(encoded).toHex());
  }

  @Test
  void emptyV16IsSeventeenBytes() throws Exception {
    RuntimeMetadataV16 empty = MetadataFixtures.emptyV16();
    RuntimeMetadataCodec lenient = new RuntimeMetadataCodec(MetadataOptions.LENIENT);
    byte[] encoded = lenient.encode(empty);

    assertEquals(17, encoded.length);
    assertEquals(empty, lenient.decode(encoded));
  }

  @Test
  void emptyV16FailsVerificationByDefault() {
    byte[] encoded = codec.encode(MetadataFixtures.emptyV16());
    DanglingTypeReferenceException e =
        assertThrows(DanglingTypeReferenceException.class, () -> codec.decode(encoded));
    assertEquals(0, e.getTypeId());
    assertEquals("extrinsic.addressType", e.getPath());
  }

  @Test
  void resolvesTotalIssuanceToU128() throws Exception {
    RuntimeMetadataV14 decoded =
        (RuntimeMetadataV14) codec.decode(codec.encode(MetadataFixtures.v14()));

    StorageEntryMetadata entry =
        decoded.pallets().stream()
            .filter(p -> p.name().equals("Balances"))
            .findFirst()
            .orElseThrow()
            .storage()
            .orElseThrow()
            .entries()
            .get(0);
    assertEquals("TotalIssuance", entry.name());
    PlainStorage plain = assertInstanceOf(PlainStorage.class, entry.type());
    TypeDescriptor type = decoded.types().resolve(plain.valueType());
    assertEquals(new PrimitiveDef(PrimitiveType.U128), type.typeDef());
  }

  @Test
  void legacyModuleOrderIsPreserved() throws Exception {
    RuntimeMetadataV12 decoded =
        (RuntimeMetadataV12)
            codec.decode(codec.encode(MetadataFixtures.legacy(MetadataVersion.V12)));
    assertEquals(
        List.of("System", "Balances"),
        decoded.modules().stream().map(ModuleMetadata::name).toList());
    assertEquals(10, decoded.modules().get(1).index().getAsInt());
  }

  // envelope errors

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 3})
  void rejectsEachFlippedMagicByte(int position) {
    byte[] encoded = codec.encode(MetadataFixtures.v14());
    encoded[position] ^= 0x01;
    BadMagicException e = assertThrows(BadMagicException.class, () -> codec.decode(encoded));
    assertEquals(BadMagicException.ERROR_CODE, e.getErrorCode());
    assertNotEquals(RuntimeMetadataCodec.MAGIC, e.getFound());
  }

  @Test
  void checksMagicBeforeTag() {
    byte[] data = Bytes.fromHex("0x00000000ff").toArray();
    assertThrows(BadMagicException.class, () -> codec.decode(data));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 17, 255})
  void rejectsUnknownVersionTags(int tag) throws Exception {
    byte[] data = Bytes.fromHex("6d657461").toArray();
    data = Arrays.copyOf(data, 5);
    data[4] = (byte) tag;
    byte[] input = data;
    UnsupportedVersionException e =
        assertThrows(UnsupportedVersionException.class, () -> codec.decode(input));
    assertEquals(tag, e.getTag());
    assertEquals(tag, RuntimeMetadataCodec.versionOf(input));
  }

  @Test
  void rejectsDisabledVersion() {
    byte[] encoded = codec.encode(MetadataFixtures.legacy(MetadataVersion.V9));
    RuntimeMetadataCodec modern = new RuntimeMetadataCodec(MetadataOptions.MODERN_ONLY);
    UnsupportedVersionException e =
        assertThrows(UnsupportedVersionException.class, () -> modern.decode(encoded));
    assertEquals(9, e.getTag());
  }

  @Test
  void refusesToEncodeDisabledVersion() {
    RuntimeMetadataCodec modern = new RuntimeMetadataCodec(MetadataOptions.MODERN_ONLY);
    assertThrows(
        IllegalArgumentException.class,
        () -> modern.encode(MetadataFixtures.legacy(MetadataVersion.V13)));
  }

  @Test
  void rejectsShortHeader() throws Exception {
    assertThrows(
        MalformedPayloadException.class,
        () -> RuntimeMetadataCodec.versionOf(Bytes.fromHex("6d65").toArray()));
    assertThrows(
        MalformedPayloadException.class,
        () -> codec.decode(Bytes.fromHex("6d657461").toArray()));
  }

  @ParameterizedTest
  @EnumSource(MetadataVersion.class)
  void rejectsTruncatedPayload(MetadataVersion version) {
    byte[] encoded = codec.encode(MetadataFixtures.of(version));
    byte[] truncated = Arrays.copyOf(encoded, encoded.length - 1);
    MalformedPayloadException e =
        assertThrows(MalformedPayloadException.class, () -> codec.decode(truncated));
    assertEquals(version, e.getVersion().orElseThrow());
    assertTrue(e.getOffset() >= RuntimeMetadataCodec.HEADER_LENGTH);
    assertTrue(e.getOffset() <= truncated.length);
  }

  @ParameterizedTest
  @EnumSource(MetadataVersion.class)
  void rejectsTrailingBytes(MetadataVersion version) {
    byte[] encoded = codec.encode(MetadataFixtures.of(version));
    byte[] padded = Arrays.copyOf(encoded, encoded.length + 1);
    MalformedPayloadException e =
        assertThrows(MalformedPayloadException.class, () -> codec.decode(padded));
    assertEquals(encoded.length, e.getOffset());
  }

  @Test
  void rejectsOversizedInput() {
    MetadataOptions small = MetadataOptions.builder().maxInputBytes(8).build();
    byte[] encoded = codec.encode(MetadataFixtures.v15());
    assertThrows(
        MalformedPayloadException.class, () -> new RuntimeMetadataCodec(small).decode(encoded));
  }

  @Test
  void decodesExpectedVersionOnly() throws Exception {
    byte[] encoded = codec.encode(MetadataFixtures.v15());
    assertEquals(MetadataVersion.V15, codec.decode(encoded, MetadataVersion.V15).version());
    UnsupportedVersionException e =
        assertThrows(
            UnsupportedVersionException.class, () -> codec.decode(encoded, MetadataVersion.V14));
    assertEquals(15, e.getTag());
  }

  @Test
  void rejectsHasherOutsideVersionTable() {
    // V8 has five hashers; index 5 only exists from V10 on
    byte[] data =
        Bytes.fromHex(
                "6d657461"
                    + "08"
                    + "04" // one module
                    + "0c" + "466f6f" // "Foo"
                    + "01" // storage present
                    + "0c" + "466f6f" // prefix
                    + "04" // one entry
                    + "0c" + "426172" // "Bar"
                    + "00" // Optional
                    + "01" // Map
                    + "05")
            .toArray();
    MalformedPayloadException e =
        assertThrows(MalformedPayloadException.class, () -> codec.decode(data));
    assertEquals(data.length - 1, e.getOffset());
  }

  @Test
  void rejectsUnorderedDeprecatedVariants() {
    byte[] data =
        Bytes.fromHex(
                "6d657461"
                    + "10"
                    + "00" // no types
                    + "04" // one pallet
                    + "0c" + "466f6f" // "Foo"
                    + "00" // no storage
                    + "01" + "00" // calls of type #0
                    + "02" + "08" // two deprecated variants
                    + "02" + "00"
                    + "01" + "00")
            .toArray();
    MalformedPayloadException e =
        assertThrows(
            MalformedPayloadException.class,
            () -> new RuntimeMetadataCodec(MetadataOptions.LENIENT).decode(data));
    assertEquals(data.length - 2, e.getOffset());
    assertTrue(e.getMessage().contains("out of order"));
  }

  @Test
  void enabledVersionsAreConfigurable() {
    MetadataOptions only14 =
        MetadataOptions.builder().enabledVersions(EnumSet.of(MetadataVersion.V14)).build();
    RuntimeMetadataCodec c = new RuntimeMetadataCodec(only14);
    assertDoesNotThrow(() -> c.decode(codec.encode(MetadataFixtures.v14())));
    assertThrows(
        UnsupportedVersionException.class, () -> c.decode(codec.encode(MetadataFixtures.v15())));
  }
}
