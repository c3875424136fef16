// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import java.util.Arrays;

/**
 * PKCS#7 padding for the AES modes whose mechanism does not pad, and the sizing of the output
 * buffers passed to the token.
 *
 * @author Lijun Liao (xipki)
 */
public class AesPadding {

  public static final int BLOCK_SIZE = 16;

  private AesPadding() {
  }

  public static byte[] pad(byte[] data) {
    return pad(data, BLOCK_SIZE);
  }

  /**
   * Appends between 1 and blockSize bytes, each holding the number of appended bytes. Block
   * aligned data gets a whole block.
   *
   * @param data      the data.
   * @param blockSize the block size.
   * @return the padded data.
   */
  public static byte[] pad(byte[] data, int blockSize) {
    int mod = blockSize - (data.length % blockSize);
    byte[] padded = Arrays.copyOf(data, data.length + mod);
    Arrays.fill(padded, data.length, padded.length, (byte) mod);
    return padded;
  }

  /**
   * Removes as many trailing bytes as the value of the last byte.
   * <p>
   * The padding bytes are not checked, so malformed padding is not detected.
   *
   * @param data the decrypted data.
   * @return the data without padding.
   */
  public static byte[] unpad(byte[] data) {
    if (data.length == 0) {
      return data;
    }

    int paddingLength = data[data.length - 1] & 0xFF;
    return Arrays.copyOf(data, Math.max(0, data.length - paddingLength));
  }

  /**
   * Returns the size of the output buffer of an encryption or decryption operation.
   * For encryption the data size is rounded up to a multiple of the key length in bytes, plus one
   * key length; this exceeds the AES block size for 192 and 256-bit keys.
   *
   * @param keyLength the key length in bits.
   * @param encrypt   true for encryption, false for decryption.
   * @param dataSize  size of incoming data.
   * @return the size of the output buffer.
   * @throws IllegalArgumentException if the size does not fit in an int.
   */
  public static int getOutputBufferSize(int keyLength, boolean encrypt, int dataSize) {
    if (!encrypt) {
      return dataSize;
    }

    long len = keyLength >> 3;
    long size = ((dataSize + len - 1) / len) * len + len;
    if (size > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("output buffer for " + dataSize + " bytes exceeds the maximal array size");
    }
    return (int) size;
  }

}
