package io.framemeta.shell;

import io.framemeta.codec.Bytes;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Reads encoded metadata from a file holding raw bytes or {@code 0x}-prefixed hex text. */
final class MetadataInput {
  private MetadataInput() {}

  static byte[] read(Path file) throws IOException {
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toString(), null, "file not found");
    }
    byte[] data = Files.readAllBytes(file);
    if (!looksLikeHex(data)) {
      return data;
    }
    String text = new String(data, StandardCharsets.US_ASCII).trim();
    if (text.startsWith("\"") && text.endsWith("\"") && text.length() >= 2) {
      text = text.substring(1, text.length() - 1);
    }
    try {
      return Bytes.fromHex(text).toArray();
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid hex text in " + file + ": " + e.getMessage(), e);
    }
  }

  // Raw metadata starts with the magic bytes, never with an ASCII "0x".
  private static boolean looksLikeHex(byte[] data) {
    int i = 0;
    while (i < data.length && Character.isWhitespace(data[i])) {
      i++;
    }
    if (i < data.length && data[i] == '"') {
      i++;
    }
    return i + 1 < data.length && data[i] == '0' && (data[i + 1] == 'x' || data[i + 1] == 'X');
  }
}
