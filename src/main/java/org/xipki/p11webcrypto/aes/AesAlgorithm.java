// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * Algorithm descriptor of an AES cipher operation: the mode plus the parameters of the mode.
 * Modes with parameters have their own subclass, {@link AesGcmParams} and {@link AesCbcParams}.
 * <p>
 * Instances are immutable.
 *
 * @author Lijun Liao (xipki)
 */
public class AesAlgorithm {

  private final AesMode mode;

  protected AesAlgorithm(AesMode mode) {
    this.mode = Functions.requireNonNull("mode", mode);
  }

  /**
   * Returns the descriptor of a mode without parameters.
   *
   * @param mode the mode.
   * @return the descriptor.
   * @throws IllegalArgumentException if the mode requires parameters.
   */
  public static AesAlgorithm of(AesMode mode) {
    if (mode == AesMode.GCM || mode == AesMode.CBC) {
      throw new IllegalArgumentException(mode.getAlgorithmName() + " requires parameters");
    }
    return new AesAlgorithm(mode);
  }

  public static AesAlgorithm ecb() {
    return of(AesMode.ECB);
  }

  public static AesCbcParams cbc(byte[] iv) {
    return new AesCbcParams(iv);
  }

  public static AesGcmParams gcm(byte[] iv) {
    return new AesGcmParams(iv, null, null);
  }

  public static AesGcmParams gcm(byte[] iv, byte[] additionalData, Integer tagLength) {
    return new AesGcmParams(iv, additionalData, tagLength);
  }

  public AesMode getMode() {
    return mode;
  }

  public String getName() {
    return mode.getAlgorithmName();
  }

  @Override
  public String toString() {
    return getName();
  }

}
