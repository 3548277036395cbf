package com.codeheadsystems.callback.common;

/**
 * Utility methods for the fixed-width integer and concatenation steps of the message frame.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Encodes a non-negative length as a 4-byte big-endian unsigned integer.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] uint32(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Value must be non-negative");
    }
    return new byte[]{
        (byte) (value >>> 24),
        (byte) (value >>> 16),
        (byte) (value >>> 8),
        (byte) value
    };
  }

  /**
   * Reads a 4-byte big-endian unsigned integer starting at {@code offset}.
   * Returned as a long so that values above {@link Integer#MAX_VALUE} stay unsigned.
   *
   * @param bytes  the source
   * @param offset the offset of the first byte
   * @return the value
   */
  public static long readUint32(byte[] bytes, int offset) {
    if (offset < 0 || bytes.length - offset < 4) {
      throw new IllegalArgumentException("Not enough bytes for a uint32 at offset " + offset);
    }
    return ((bytes[offset] & 0xFFL) << 24)
        | ((bytes[offset + 1] & 0xFFL) << 16)
        | ((bytes[offset + 2] & 0xFFL) << 8)
        | (bytes[offset + 3] & 0xFFL);
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
}
