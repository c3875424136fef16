// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

/**
 * Helper functions used by the wrapper and the WebCrypto layer.
 *
 * @author Lijun Liao (xipki)
 */
public class Functions {

  private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

  private Functions() {
  }

  public static <T> T requireNonNull(String paramName, T param) {
    if (param == null) {
      throw new NullPointerException("Argument '" + paramName + "' must not be null.");
    }
    return param;
  }

  public static byte[] copyOf(byte[] bytes) {
    return bytes == null ? null : bytes.clone();
  }

  /**
   * Converts a byte array to a hexadecimal String.
   *
   * @param value the byte array to be converted.
   * @return the hexadecimal representation of the byte array.
   */
  public static String toHex(byte[] value) {
    if (value == null) {
      return null;
    }

    char[] chars = new char[2 * value.length];
    for (int i = 0; i < value.length; i++) {
      int b = value[i] & 0xFF;
      chars[2 * i] = HEX_CHARS[b >>> 4];
      chars[2 * i + 1] = HEX_CHARS[b & 0x0F];
    }
    return new String(chars);
  }

  public static byte[] decodeHex(String hex) {
    char[] chars = hex.toCharArray();
    final int len = chars.length;
    if (len % 2 != 0) {
      throw new IllegalArgumentException("odd number of characters");
    }

    byte[] out = new byte[len / 2];
    for (int i = 0, j = 0; j < len; i++) {
      int f = Character.digit(chars[j++], 16) << 4;
      f |= Character.digit(chars[j++], 16);
      out[i] = (byte) (f & 0xFF);
    }
    return out;
  }

  public static String toString(String prefix, byte[] bytes) {
    if (bytes == null) {
      return prefix + "<NULL_PTR>";
    }

    return prefix + "byte[" + bytes.length + "]: " + toHex(bytes);
  }

}
