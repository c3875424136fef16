// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * Parameters of AES-CBC.
 *
 * @author Lijun Liao (xipki)
 */
public class AesCbcParams extends AesAlgorithm {

  private final byte[] iv;

  public AesCbcParams(byte[] iv) {
    super(AesMode.CBC);
    this.iv = Functions.copyOf(Functions.requireNonNull("iv", iv));
  }

  public byte[] getIv() {
    return iv.clone();
  }

  @Override
  public String toString() {
    return getName() + " (iv=" + Functions.toHex(iv) + ")";
  }

}
