package io.framemeta.codec;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

/** Growable buffer producing compact-binary (SCALE) encoded output. */
public final class ScaleWriter {

  /**
   * Writes one value of type {@code T}.
   *
   * @param <T> the encoded type
   */
  @FunctionalInterface
  public interface Encoder<T> {
    void encode(ScaleWriter writer, T value);
  }

  private byte[] buf;
  private int size;

  public ScaleWriter() {
    this(256);
  }

  public ScaleWriter(int initialCapacity) {
    this.buf = new byte[Math.max(16, initialCapacity)];
  }

  private void ensure(int extra) {
    int needed = size + extra;
    if (needed < 0) {
      throw new IllegalStateException("encoded output exceeds 2 GiB");
    }
    if (needed > buf.length) {
      buf = Arrays.copyOf(buf, Math.max(needed, buf.length << 1));
    }
  }

  /** Returns the number of bytes written so far. */
  public int size() {
    return size;
  }

  public ScaleWriter writeU8(int v) {
    if ((v & ~0xFF) != 0) {
      throw new IllegalArgumentException("u8 out of range: " + v);
    }
    ensure(1);
    buf[size++] = (byte) v;
    return this;
  }

  public ScaleWriter writeU16(int v) {
    if ((v & ~0xFFFF) != 0) {
      throw new IllegalArgumentException("u16 out of range: " + v);
    }
    writeLittleEndian(v, 2);
    return this;
  }

  public ScaleWriter writeU32(long v) {
    if ((v & ~0xFFFF_FFFFL) != 0) {
      throw new IllegalArgumentException("u32 out of range: " + v);
    }
    writeLittleEndian(v, 4);
    return this;
  }

  /** Writes all 64 bits of {@code v}, little-endian. */
  public ScaleWriter writeU64(long v) {
    writeLittleEndian(v, 8);
    return this;
  }

  private void writeLittleEndian(long v, int n) {
    ensure(n);
    for (int i = 0; i < n; i++) {
      buf[size++] = (byte) (v >>> (8 * i));
    }
  }

  public ScaleWriter writeBool(boolean v) {
    return writeU8(v ? 1 : 0);
  }

  /**
   * Writes {@code v} in the shortest compact form.
   *
   * @param v a non-negative value
   * @return this writer
   */
  public ScaleWriter writeCompact(long v) {
    if (v < 0) {
      throw new IllegalArgumentException("compact value must be non-negative: " + v);
    }
    if (v < 1L << 6) {
      writeU8((int) (v << 2));
    } else if (v < 1L << 14) {
      writeLittleEndian((v << 2) | 0b01, 2);
    } else if (v < 1L << 30) {
      writeLittleEndian((v << 2) | 0b10, 4);
    } else {
      int n = Math.max(4, (64 - Long.numberOfLeadingZeros(v) + 7) / 8);
      writeU8(((n - 4) << 2) | 0b11);
      writeLittleEndian(v, n);
    }
    return this;
  }

  /** Writes a fixed-size byte array without a length prefix. */
  public ScaleWriter writeFixed(Bytes bytes) {
    byte[] raw = bytes.unsafeArray();
    ensure(raw.length);
    System.arraycopy(raw, 0, buf, size, raw.length);
    size += raw.length;
    return this;
  }

  /** Writes a length-prefixed byte vector. */
  public ScaleWriter writeBytes(Bytes bytes) {
    writeCompact(bytes.length());
    return writeFixed(bytes);
  }

  /**
   * Writes a length-prefixed UTF-8 string.
   *
   * @throws IllegalArgumentException if the string holds an unpaired surrogate
   */
  public ScaleWriter writeString(String s) {
    byte[] raw = utf8(s);
    writeCompact(raw.length);
    ensure(raw.length);
    System.arraycopy(raw, 0, buf, size, raw.length);
    size += raw.length;
    return this;
  }

  public ScaleWriter writeStrings(Collection<String> strings) {
    return writeList(strings, ScaleWriter::writeString);
  }

  public <T> ScaleWriter writeOptional(Optional<T> value, Encoder<? super T> encoder) {
    if (value.isPresent()) {
      writeU8(1);
      encoder.encode(this, value.get());
    } else {
      writeU8(0);
    }
    return this;
  }

  /** Writes a length prefix followed by every element in iteration order. */
  public <T> ScaleWriter writeList(Collection<? extends T> values, Encoder<? super T> encoder) {
    writeCompact(values.size());
    for (T v : values) {
      encoder.encode(this, v);
    }
    return this;
  }

  /** Returns a copy of the bytes written so far. */
  public byte[] toByteArray() {
    return Arrays.copyOf(buf, size);
  }

  public Bytes toBytes() {
    return Bytes.wrap(toByteArray());
  }

  private static byte[] utf8(String s) {
    CharsetEncoder encoder =
        StandardCharsets.UTF_8
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      ByteBuffer out = encoder.encode(CharBuffer.wrap(s));
      byte[] raw = new byte[out.remaining()];
      out.get(raw);
      return raw;
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("Unpaired surrogate in string: " + e.getMessage(), e);
    }
  }
}
