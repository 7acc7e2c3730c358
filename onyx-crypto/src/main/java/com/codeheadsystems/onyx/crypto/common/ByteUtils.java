package com.codeheadsystems.onyx.crypto.common;

import org.bouncycastle.util.encoders.Hex;

/**
 * Utility methods for splitting and joining octet strings.
 */
public class ByteUtils {

  private ByteUtils() {
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
   * Returns the first {@code length} bytes of the input.
   *
   * @param bytes  the bytes
   * @param length the number of leading bytes to keep
   * @return the byte [ ]
   */
  public static byte[] head(byte[] bytes, int length) {
    checkLength(bytes, length);
    byte[] out = new byte[length];
    System.arraycopy(bytes, 0, out, 0, length);
    return out;
  }

  /**
   * Returns the last {@code length} bytes of the input.
   *
   * @param bytes  the bytes
   * @param length the number of trailing bytes to keep
   * @return the byte [ ]
   */
  public static byte[] tail(byte[] bytes, int length) {
    checkLength(bytes, length);
    byte[] out = new byte[length];
    System.arraycopy(bytes, bytes.length - length, out, 0, length);
    return out;
  }

  /**
   * Lower-case hex encoding.
   *
   * @param bytes the bytes
   * @return the hex string
   */
  public static String toHex(byte[] bytes) {
    return Hex.toHexString(bytes);
  }

  private static void checkLength(byte[] bytes, int length) {
    if (length < 0 || length > bytes.length) {
      throw new IllegalArgumentException("Cannot take " + length + " bytes from an array of " + bytes.length);
    }
  }
}
