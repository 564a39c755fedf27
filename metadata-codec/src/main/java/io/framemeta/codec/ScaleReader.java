package io.framemeta.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bounded cursor over a byte array holding compact-binary (SCALE) encoded data.
 *
 * <p>Every read is checked against the remaining bytes of the window, and every length prefix is
 * checked against the remaining bytes before anything is allocated, so malformed or truncated
 * input fails with a {@link ScaleCodecException} instead of over-allocating or reading past the
 * end.
 *
 * <p>Compact integers are decoded strictly: an encoding that is not the shortest possible one for
 * its value is rejected, which keeps decode followed by encode bit-exact.
 */
public final class ScaleReader {

  /**
   * Reads one value of type {@code T}.
   *
   * @param <T> the decoded type
   */
  @FunctionalInterface
  public interface Decoder<T> {
    /**
     * Decodes the next value.
     *
     * @param reader the reader positioned at the value
     * @return the value
     * @throws ScaleCodecException if the bytes are not a valid encoding
     */
    T decode(ScaleReader reader) throws ScaleCodecException;
  }

  private static final long MAX_ONE_BYTE = (1L << 6) - 1;
  private static final long MAX_TWO_BYTE = (1L << 14) - 1;
  private static final long MAX_FOUR_BYTE = (1L << 30) - 1;

  private final byte[] data;
  private final int start;
  private final int limit;
  private int position;

  private ScaleReader(byte[] data, int start, int limit) {
    this.data = data;
    this.start = start;
    this.limit = limit;
    this.position = start;
  }

  /**
   * Creates a reader over the whole array. The array is not copied.
   *
   * @param data the encoded bytes
   * @return a reader positioned at offset 0
   */
  public static ScaleReader of(byte[] data) {
    return new ScaleReader(data, 0, data.length);
  }

  /**
   * Creates a reader over a window of the array. Offsets reported in errors are relative to the
   * window start.
   *
   * @param data the encoded bytes
   * @param offset the window start
   * @param length the window length
   * @return a reader positioned at the window start
   */
  public static ScaleReader of(byte[] data, int offset, int length) {
    if (offset < 0 || length < 0 || offset > data.length - length) {
      throw new IndexOutOfBoundsException(
          "window [" + offset + ", +" + length + ") outside array of " + data.length);
    }
    return new ScaleReader(data, offset, offset + length);
  }

  /** Returns the current offset, relative to the window start. */
  public int position() {
    return position - start;
  }

  /** Returns the number of unread bytes. */
  public int remaining() {
    return limit - position;
  }

  /** Returns whether unread bytes remain. */
  public boolean hasRemaining() {
    return position < limit;
  }

  /**
   * Creates an exception describing a failure at the current position.
   *
   * @param message what was wrong
   * @return the exception, for the caller to throw
   */
  public ScaleCodecException fail(String message) {
    return new ScaleCodecException(message, position());
  }

  private void require(int n, String what) throws ScaleCodecException {
    if (n > limit - position) {
      throw fail("unexpected end of input reading " + what + " (" + n + " bytes needed)");
    }
  }

  /** Reads an unsigned byte. */
  public int readU8() throws ScaleCodecException {
    require(1, "u8");
    return data[position++] & 0xFF;
  }

  /** Reads a little-endian unsigned 16-bit value. */
  public int readU16() throws ScaleCodecException {
    require(2, "u16");
    int v = (data[position] & 0xFF) | (data[position + 1] & 0xFF) << 8;
    position += 2;
    return v;
  }

  /** Reads a little-endian unsigned 32-bit value. */
  public long readU32() throws ScaleCodecException {
    require(4, "u32");
    long v = readLittleEndian(position, 4);
    position += 4;
    return v;
  }

  /** Reads a little-endian 64-bit value. */
  public long readU64() throws ScaleCodecException {
    require(8, "u64");
    long v = readLittleEndian(position, 8);
    position += 8;
    return v;
  }

  private long readLittleEndian(int at, int n) {
    long v = 0;
    for (int i = n - 1; i >= 0; i--) {
      v = (v << 8) | (data[at + i] & 0xFF);
    }
    return v;
  }

  /** Reads a boolean encoded as a single {@code 0x00} or {@code 0x01} byte. */
  public boolean readBool() throws ScaleCodecException {
    int b = readU8();
    if (b > 1) {
      position--;
      throw fail("invalid bool byte 0x" + Integer.toHexString(b));
    }
    return b == 1;
  }

  /**
   * Reads a compact-encoded unsigned integer of at most 63 bits.
   *
   * @return the value, never negative
   * @throws ScaleCodecException on truncation, overflow or a non-canonical encoding
   */
  public long readCompact() throws ScaleCodecException {
    int at = position;
    int first = readU8();
    switch (first & 0b11) {
      case 0b00:
        return first >>> 2;
      case 0b01:
        {
          position = at;
          long v = readU16() >>> 2;
          if (v <= MAX_ONE_BYTE) {
            position = at;
            throw fail("non-canonical two-byte compact " + v);
          }
          return v;
        }
      case 0b10:
        {
          position = at;
          long v = readU32() >>> 2;
          if (v <= MAX_TWO_BYTE) {
            position = at;
            throw fail("non-canonical four-byte compact " + v);
          }
          return v;
        }
      default:
        {
          int n = (first >>> 2) + 4;
          if (n > 8) {
            position = at;
            throw fail("compact integer of " + n + " bytes exceeds 64 bits");
          }
          require(n, "compact integer");
          long v = readLittleEndian(position, n);
          int top = data[position + n - 1] & 0xFF;
          position += n;
          if (n == 8 && v < 0) {
            position = at;
            throw fail("compact integer exceeds 63 bits");
          }
          if (n == 4 ? v <= MAX_FOUR_BYTE : top == 0) {
            position = at;
            throw fail("non-canonical big-integer compact");
          }
          return v;
        }
    }
  }

  /** Reads a compact integer that must fit an unsigned 32-bit value. */
  public long readCompactU32() throws ScaleCodecException {
    int at = position;
    long v = readCompact();
    if (v > 0xFFFF_FFFFL) {
      position = at;
      throw fail("compact value " + v + " exceeds u32");
    }
    return v;
  }

  /**
   * Reads a compact integer used as an index or identifier; it must fit a non-negative int.
   *
   * @param what description used in the error message
   * @return the value
   * @throws ScaleCodecException if the value does not fit
   */
  public int readCompactInt(String what) throws ScaleCodecException {
    int at = position;
    long v = readCompact();
    if (v > Integer.MAX_VALUE) {
      position = at;
      throw fail(what + " " + v + " out of range");
    }
    return (int) v;
  }

  /**
   * Reads a sequence length prefix. Every element occupies at least one byte, so a length larger
   * than the remaining input can never be satisfied and is rejected up front.
   *
   * @return the element count
   * @throws ScaleCodecException if the length is impossible for the remaining input
   */
  public int readLength() throws ScaleCodecException {
    int at = position;
    long len = readCompact();
    if (len > remaining()) {
      position = at;
      throw fail("length prefix " + len + " exceeds remaining " + remaining() + " bytes");
    }
    return (int) len;
  }

  /**
   * Reads exactly {@code n} raw bytes, as for a fixed-size array.
   *
   * @param n the byte count
   * @return the bytes
   */
  public Bytes readFixed(int n) throws ScaleCodecException {
    require(n, "[u8; " + n + "]");
    byte[] out = new byte[n];
    System.arraycopy(data, position, out, 0, n);
    position += n;
    return Bytes.wrap(out);
  }

  /** Reads a length-prefixed byte vector. */
  public Bytes readBytes() throws ScaleCodecException {
    int len = readLength();
    return readFixed(len);
  }

  /** Reads a length-prefixed strict UTF-8 string. */
  public String readString() throws ScaleCodecException {
    int len = readLength();
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      String s = decoder.decode(ByteBuffer.wrap(data, position, len)).toString();
      position += len;
      return s;
    } catch (CharacterCodingException e) {
      throw fail("string of " + len + " bytes is not valid UTF-8");
    }
  }

  /** Reads a list of strings. */
  public List<String> readStrings() throws ScaleCodecException {
    return readList(ScaleReader::readString);
  }

  /**
   * Reads the one-byte tag of an {@code Option}.
   *
   * @return whether a value follows
   */
  public boolean readOptionTag() throws ScaleCodecException {
    int tag = readU8();
    if (tag > 1) {
      position--;
      throw fail("invalid Option tag " + tag);
    }
    return tag == 1;
  }

  /**
   * Reads an optional value.
   *
   * @param decoder decoder for the value
   * @param <T> the value type
   * @return the value, or empty
   */
  public <T> Optional<T> readOptional(Decoder<T> decoder) throws ScaleCodecException {
    return readOptionTag() ? Optional.of(decoder.decode(this)) : Optional.empty();
  }

  /**
   * Reads the variant index of an enum.
   *
   * @param typeName enum name used in the error message
   * @param variantCount number of variants the enum has
   * @return the index, below {@code variantCount}
   */
  public int readEnumTag(String typeName, int variantCount) throws ScaleCodecException {
    int tag = readU8();
    if (tag >= variantCount) {
      position--;
      throw fail("invalid " + typeName + " variant index " + tag);
    }
    return tag;
  }

  /**
   * Reads a length-prefixed list.
   *
   * @param decoder decoder for each element
   * @param <T> the element type
   * @return an unmodifiable list
   */
  public <T> List<T> readList(Decoder<T> decoder) throws ScaleCodecException {
    int len = readLength();
    if (len == 0) {
      return Collections.emptyList();
    }
    List<T> out = new ArrayList<>(len);
    for (int i = 0; i < len; i++) {
      out.add(decoder.decode(this));
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * Fails unless the whole window has been consumed.
   *
   * @param what description of the value that should have ended here
   */
  public void expectEnd(String what) throws ScaleCodecException {
    if (hasRemaining()) {
      throw fail(remaining() + " trailing bytes after " + what);
    }
  }
}
