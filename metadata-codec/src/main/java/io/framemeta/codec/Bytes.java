package io.framemeta.codec;

import java.util.Arrays;

/**
 * Immutable byte string with value semantics.
 *
 * <p>Used for opaque encoded blobs (storage defaults, constant values, custom values) so that the
 * model records containing them compare by content.
 */
public final class Bytes {
  private static final char[] HEX = "0123456789abcdef".toCharArray();
  private static final Bytes EMPTY = new Bytes(new byte[0]);

  private final byte[] data;

  private Bytes(byte[] data) {
    this.data = data;
  }

  /** Returns the empty byte string. */
  public static Bytes empty() {
    return EMPTY;
  }

  /**
   * Creates a byte string holding a copy of the given array.
   *
   * @param data the bytes to copy
   * @return the byte string
   */
  public static Bytes of(byte... data) {
    return data.length == 0 ? EMPTY : new Bytes(data.clone());
  }

  /** Wraps an array the caller promises never to modify again. */
  static Bytes wrap(byte[] data) {
    return data.length == 0 ? EMPTY : new Bytes(data);
  }

  /**
   * Parses a hex string, with or without a {@code 0x} prefix.
   *
   * @param hex the hex text
   * @return the decoded bytes
   * @throws IllegalArgumentException if the text is not an even-length hex string
   */
  public static Bytes fromHex(String hex) {
    String s = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    if ((s.length() & 1) != 0) {
      throw new IllegalArgumentException("Odd number of hex digits: " + s.length());
    }
    byte[] out = new byte[s.length() / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(s.charAt(2 * i), 16);
      int lo = Character.digit(s.charAt(2 * i + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("Invalid hex digit near index " + (2 * i));
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return wrap(out);
  }

  /** Returns the number of bytes. */
  public int length() {
    return data.length;
  }

  /** Returns whether this byte string has no bytes. */
  public boolean isEmpty() {
    return data.length == 0;
  }

  /**
   * Returns the byte at the given index as an unsigned value.
   *
   * @param index the index
   * @return the value in {@code 0..255}
   */
  public int get(int index) {
    return data[index] & 0xFF;
  }

  /** Returns a copy of the contents. */
  public byte[] toArray() {
    return data.clone();
  }

  byte[] unsafeArray() {
    return data;
  }

  /** Returns the contents as {@code 0x}-prefixed lowercase hex. */
  public String toHex() {
    char[] out = new char[2 + data.length * 2];
    out[0] = '0';
    out[1] = 'x';
    for (int i = 0; i < data.length; i++) {
      int v = data[i] & 0xFF;
      out[2 + 2 * i] = HEX[v >>> 4];
      out[3 + 2 * i] = HEX[v & 0x0F];
    }
    return new String(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Bytes)) return false;
    return Arrays.equals(data, ((Bytes) o).data);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
