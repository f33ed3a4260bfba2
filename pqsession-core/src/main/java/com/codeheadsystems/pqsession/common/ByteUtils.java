package com.codeheadsystems.pqsession.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Utility methods for octet string encoding used by the handshake transcript and key schedule.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to an octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Prefixes {@code data} with its length as a 2-byte big-endian integer.
   * A {@code null} input encodes as an empty vector.
   *
   * @param data the data
   * @return the length-prefixed vector
   */
  public static byte[] encodeVector(byte[] data) {
    byte[] body = data == null ? new byte[0] : data;
    return concat(I2OSP(body.length, 2), body);
  }

  /**
   * Length-prefixed UTF-8 encoding of a string; {@code null} encodes as an empty vector.
   *
   * @param value the value
   * @return the length-prefixed vector
   */
  public static byte[] encodeVector(String value) {
    return encodeVector(value == null ? null : value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Overwrites the given arrays with zeros. Null entries are skipped.
   *
   * @param arrays the arrays to clear
   */
  public static void zeroize(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }

  /**
   * Returns a copy, or {@code null} for {@code null}.
   *
   * @param data the data
   * @return the copy
   */
  public static byte[] copy(byte[] data) {
    return data == null ? null : data.clone();
  }
}
