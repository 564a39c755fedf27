package io.framemeta.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ScaleWriterTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0x00",
    "1, 0x04",
    "63, 0xfc",
    "64, 0x0101",
    "16383, 0xfdff",
    "16384, 0x02000100",
    "1073741823, 0xfeffffff",
    "1073741824, 0x0300000040",
    "4294967296, 0x070000000001",
    "9223372036854775807, 0x13ffffffffffffff7f"
  })
  void writesShortestCompact(long value, String hex) {
    assertEquals(hex, new ScaleWriter().writeCompact(value).toBytes().toHex());
  }

  @Test
  void rejectsNegativeCompact() {
    assertThrows(IllegalArgumentException.class, () -> new ScaleWriter().writeCompact(-1));
  }

  @Test
  void rejectsOutOfRangeFixedWidth() {
    ScaleWriter w = new ScaleWriter();
    assertThrows(IllegalArgumentException.class, () -> w.writeU8(256));
    assertThrows(IllegalArgumentException.class, () -> w.writeU16(-1));
    assertThrows(IllegalArgumentException.class, () -> w.writeU32(1L << 32));
  }

  @Test
  void writesSupplementaryCharactersAsUtf8() {
    assertEquals("0x10f09f9880", new ScaleWriter().writeString("\uD83D\uDE00").toBytes().toHex());
  }

  @Test
  void rejectsUnpairedSurrogates() {
    ScaleWriter w = new ScaleWriter();
    assertThrows(IllegalArgumentException.class, () -> w.writeString("a\uD83D"));
    assertThrows(IllegalArgumentException.class, () -> w.writeString("\uDE00b"));
    assertEquals(0, w.size());
  }

  @Test
  void writesComposites() {
    ScaleWriter w = new ScaleWriter(1);
    w.writeString("meta")
        .writeOptional(Optional.<String>empty(), ScaleWriter::writeString)
        .writeOptional(Optional.of(true), ScaleWriter::writeBool)
        .writeList(List.of(1, 2), ScaleWriter::writeU16)
        .writeU32(0x6174656dL);
    assertEquals("0x106d657461" + "00" + "0101" + "0801000200" + "6d657461", w.toBytes().toHex());
    assertEquals(w.size(), w.toByteArray().length);
  }

  @Test
  void growsPastInitialCapacity() {
    ScaleWriter w = new ScaleWriter(16);
    byte[] big = new byte[1000];
    big[999] = 7;
    w.writeBytes(Bytes.of(big));
    byte[] out = w.toByteArray();
    assertEquals(1002, out.length);
    assertEquals(7, out[1001]);
  }
}
