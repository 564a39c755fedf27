package io.framemeta.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ScaleReaderTest {

  private static ScaleReader reader(String hex) {
    return ScaleReader.of(Bytes.fromHex(hex).toArray());
  }

  @Test
  void readsLittleEndianIntegers() throws Exception {
    ScaleReader r = reader("2a" + "3412" + "78563412" + "efcdab8967452301");
    assertEquals(0x2a, r.readU8());
    assertEquals(0x1234, r.readU16());
    assertEquals(0x12345678L, r.readU32());
    assertEquals(0x0123456789abcdefL, r.readU64());
    assertFalse(r.hasRemaining());
  }

  @Test
  void readsUnsignedU32AboveIntRange() throws Exception {
    assertEquals(0xFFFF_FFFFL, reader("ffffffff").readU32());
  }

  @ParameterizedTest
  @CsvSource({
    "00, 0",
    "04, 1",
    "a8, 42",
    "fc, 63",
    "0101, 64",
    "fdff, 16383",
    "02000100, 16384",
    "feffffff, 1073741823",
    "0300000040, 1073741824",
    "03ffffffff, 4294967295",
    "070000000001, 4294967296",
    "13ffffffffffffff7f, 9223372036854775807"
  })
  void decodesCanonicalCompact(String hex, long expected) throws Exception {
    ScaleReader r = reader(hex);
    assertEquals(expected, r.readCompact());
    assertFalse(r.hasRemaining());
  }

  @ParameterizedTest
  @CsvSource({
    // 1 in two-byte mode
    "0500",
    // 63 in two-byte mode
    "fd00",
    // 16383 in four-byte mode
    "feff0000",
    // 2^30 - 1 in big-integer mode
    "03ffffff3f",
    // five bytes with a zero top byte
    "07ffffffff00"
  })
  void rejectsNonCanonicalCompact(String hex) {
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> reader(hex).readCompact());
    assertEquals(0, e.getOffset());
    assertTrue(e.getMessage().contains("non-canonical"), e.getMessage());
  }

  @Test
  void rejectsCompactWiderThan63Bits() {
    assertThrows(ScaleCodecException.class, () -> reader("13ffffffffffffffff").readCompact());
    assertThrows(ScaleCodecException.class, () -> reader("17000000000000000001").readCompact());
  }

  @Test
  void compactU32RejectsLargerValues() {
    assertThrows(ScaleCodecException.class, () -> reader("070000000001").readCompactU32());
  }

  @Test
  void boolAcceptsOnlyZeroAndOne() throws Exception {
    ScaleReader r = reader("0001");
    assertFalse(r.readBool());
    assertTrue(r.readBool());
    ScaleCodecException e = assertThrows(ScaleCodecException.class, () -> reader("02").readBool());
    assertEquals(0, e.getOffset());
  }

  @Test
  void readsStringsAndBytes() throws Exception {
    // "meta", then 3 bytes
    ScaleReader r = reader("106d657461" + "0c010203");
    assertEquals("meta", r.readString());
    assertEquals(Bytes.of((byte) 1, (byte) 2, (byte) 3), r.readBytes());
  }

  @Test
  void rejectsMalformedUtf8() {
    // lone continuation byte
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> reader("0480").readString());
    assertTrue(e.getMessage().contains("UTF-8"));
  }

  @Test
  void lengthPrefixLargerThanInputFailsBeforeAllocating() {
    // claims 2^30 elements with 1 byte behind it
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> reader("0300000040ff").readBytes());
    assertEquals(0, e.getOffset());
    assertTrue(e.getMessage().contains("exceeds remaining"));
  }

  @Test
  void truncatedReadReportsOffset() throws Exception {
    ScaleReader r = reader("0102");
    r.readU8();
    ScaleCodecException e = assertThrows(ScaleCodecException.class, r::readU32);
    assertEquals(1, e.getOffset());
  }

  @Test
  void readsOptionsAndLists() throws Exception {
    ScaleReader r = reader("00" + "0107" + "0c010203");
    assertEquals(Optional.empty(), r.readOptional(ScaleReader::readU8));
    assertEquals(Optional.of(7), r.readOptional(ScaleReader::readU8));
    assertEquals(List.of(1, 2, 3), r.readList(ScaleReader::readU8));
  }

  @Test
  void rejectsInvalidOptionAndEnumTags() {
    assertThrows(ScaleCodecException.class, () -> reader("02").readOptionTag());
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> reader("03").readEnumTag("Thing", 3));
    assertTrue(e.getMessage().contains("Thing"));
  }

  @Test
  void windowOffsetsAreRelative() throws Exception {
    byte[] data = Bytes.fromHex("ffff2a").toArray();
    ScaleReader r = ScaleReader.of(data, 2, 1);
    assertEquals(0, r.position());
    assertEquals(0x2a, r.readU8());
    ScaleCodecException e = assertThrows(ScaleCodecException.class, r::readU8);
    assertEquals(1, e.getOffset());
  }

  @Test
  void expectEndRejectsTrailingBytes() throws Exception {
    ScaleReader r = reader("0000");
    r.readU8();
    assertThrows(ScaleCodecException.class, () -> r.expectEnd("value"));
    r.readU8();
    assertDoesNotThrow(() -> r.expectEnd("value"));
  }
}
