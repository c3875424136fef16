// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * The algorithm of an AES key: the mode it is bound to and its length in bits. Used both to request
 * the generation of a key and to describe an existing key.
 *
 * @author Lijun Liao (xipki)
 */
public class AesKeyAlgorithm {

  private final AesMode mode;

  private final int length;

  public AesKeyAlgorithm(AesMode mode, int length) {
    this.mode = Functions.requireNonNull("mode", mode);
    this.length = length;
  }

  public AesMode getMode() {
    return mode;
  }

  public String getName() {
    return mode.getAlgorithmName();
  }

  /**
   * Returns the key length in bits.
   *
   * @return the key length in bits.
   */
  public int getLength() {
    return length;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof AesKeyAlgorithm)) {
      return false;
    }

    AesKeyAlgorithm other = (AesKeyAlgorithm) obj;
    return mode == other.mode && length == other.length;
  }

  @Override
  public int hashCode() {
    return mode.hashCode() * 31 + length;
  }

  @Override
  public String toString() {
    return getName() + "/" + length;
  }

}
