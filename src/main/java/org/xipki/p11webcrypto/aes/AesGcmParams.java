// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * Parameters of AES-GCM.
 *
 * @author Lijun Liao (xipki)
 */
public class AesGcmParams extends AesAlgorithm {

  private final byte[] iv;

  private final byte[] additionalData;

  private final Integer tagLength;

  /**
   * Constructor.
   *
   * @param iv             the initialization vector. Must not be null.
   * @param additionalData the additional authenticated data. May be null.
   * @param tagLength      the tag length in bits. May be null.
   */
  public AesGcmParams(byte[] iv, byte[] additionalData, Integer tagLength) {
    super(AesMode.GCM);
    this.iv = Functions.copyOf(Functions.requireNonNull("iv", iv));
    this.additionalData = Functions.copyOf(additionalData);
    this.tagLength = tagLength;
  }

  public byte[] getIv() {
    return iv.clone();
  }

  public byte[] getAdditionalData() {
    return Functions.copyOf(additionalData);
  }

  public Integer getTagLength() {
    return tagLength;
  }

  @Override
  public String toString() {
    return getName() + " (iv=" + Functions.toHex(iv)
        + (additionalData == null ? "" : ", additionalData=" + Functions.toHex(additionalData))
        + (tagLength == null ? "" : ", tagLength=" + tagLength) + ")";
  }

}
