package io.framemeta.metadata.internal;

import static org.junit.jupiter.api.Assertions.*;

import io.framemeta.codec.Bytes;
import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.common.StorageHasher;
import io.framemeta.metadata.modern.MapStorage;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.v15.CustomMetadata;
import io.framemeta.metadata.v15.CustomValueMetadata;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

public class ModernCodecTest {

  private static ScaleReader reader(String hex) {
    return ScaleReader.of(Bytes.fromHex(hex).toArray());
  }

  @Test
  void customValuesAreWrittenInKeyOrder() throws Exception {
    TreeMap<String, CustomValueMetadata> map = new TreeMap<>();
    map.put("b", new CustomValueMetadata(TypeId.of(1), Bytes.fromHex("ff")));
    map.put("a", new CustomValueMetadata(TypeId.of(0), Bytes.empty()));
    ScaleWriter w = new ScaleWriter(16);
    ModernCodec.writeCustom(w, new CustomMetadata(map));

    String hex = "0x08" + "0461" + "00" + "00" + "0462" + "04" + "04ff";
    assertEquals(hex, w.toBytes().toHex());
    assertEquals(new CustomMetadata(map), ModernCodec.readCustom(reader(hex)));
  }

  @Test
  void rejectsUnsortedCustomKeys() {
    String hex = "0x08" + "0462" + "00" + "00" + "0461" + "00" + "00";
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> ModernCodec.readCustom(reader(hex)));
    assertEquals(5, e.getOffset());
  }

  @Test
  void rejectsDuplicateCustomKeys() {
    String hex = "0x08" + "0461" + "00" + "00" + "0461" + "00" + "00";
    assertThrows(ScaleCodecException.class, () -> ModernCodec.readCustom(reader(hex)));
  }

  @Test
  void customKeysFollowUtf8ByteOrder() throws Exception {
    // U+FFFD is EF BF BD, U+1F600 is F0 9F 98 80; UTF-16 code units order them the other way
    String replacement = "\uFFFD";
    String emoji = "\uD83D\uDE00";
    TreeMap<String, CustomValueMetadata> map = new TreeMap<>();
    map.put(replacement, new CustomValueMetadata(TypeId.of(0), Bytes.empty()));
    map.put(emoji, new CustomValueMetadata(TypeId.of(0), Bytes.empty()));
    CustomMetadata custom = new CustomMetadata(map);
    assertEquals(List.of(replacement, emoji), List.copyOf(custom.map().keySet()));

    String hex = "0x08" + "0cefbfbd" + "00" + "00" + "10f09f9880" + "00" + "00";
    ScaleWriter w = new ScaleWriter(16);
    ModernCodec.writeCustom(w, custom);
    assertEquals(hex, w.toBytes().toHex());
    assertEquals(custom, ModernCodec.readCustom(reader(hex)));

    String swapped = "0x08" + "10f09f9880" + "00" + "00" + "0cefbfbd" + "00" + "00";
    ScaleCodecException e =
        assertThrows(ScaleCodecException.class, () -> ModernCodec.readCustom(reader(swapped)));
    assertEquals(8, e.getOffset());
  }

  @Test
  void customOrderIgnoresCallerComparator() throws Exception {
    TreeMap<String, CustomValueMetadata> reversed = new TreeMap<>(Comparator.reverseOrder());
    reversed.put("a", new CustomValueMetadata(TypeId.of(0), Bytes.empty()));
    reversed.put("b", new CustomValueMetadata(TypeId.of(1), Bytes.fromHex("ff")));
    CustomMetadata custom = new CustomMetadata(reversed);
    assertEquals("a", custom.map().firstKey());

    ScaleWriter w = new ScaleWriter(16);
    ModernCodec.writeCustom(w, custom);
    assertEquals(custom, ModernCodec.readCustom(reader(w.toBytes().toHex())));
  }

  @Test
  void mapEntryUsesModernHasherTable() throws Exception {
    MapStorage map =
        new MapStorage(
            List.of(StorageHasher.BLAKE2_128_CONCAT, StorageHasher.IDENTITY),
            TypeId.of(3),
            TypeId.of(4));
    ScaleWriter w = new ScaleWriter(16);
    ModernCodec.writeStorageEntryType(w, map);
    assertEquals("0x01" + "08" + "0206" + "0c" + "10", w.toBytes().toHex());
    assertEquals(map, ModernCodec.readStorageEntryType(reader(w.toBytes().toHex())));
  }

  @Test
  void rejectsHasherBeyondTable() {
    assertThrows(
        ScaleCodecException.class,
        () -> ModernCodec.readStorageEntryType(reader("0x01" + "04" + "07" + "00" + "00")));
  }
}
