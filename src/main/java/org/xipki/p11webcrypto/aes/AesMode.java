// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.MalformedAlgorithmNameException;
import org.xipki.p11webcrypto.NotSupportedException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The modes of the WebCrypto AES algorithm family.
 *
 * @author Lijun Liao (xipki)
 */
public enum AesMode {

  CTR(false),
  CBC(false),
  GCM(false),
  KW(false),
  ECB(true);

  private static final Pattern NAME_PATTERN = Pattern.compile("AES-(\\w+)");

  private final boolean padding;

  AesMode(boolean padding) {
    this.padding = padding;
  }

  /**
   * Whether the data must be padded before and unpadded after the token call, because the
   * mechanism of this mode does not pad.
   *
   * @return true if this library pads the data.
   */
  public boolean isPadding() {
    return padding;
  }

  /**
   * Returns the WebCrypto name, e.g. AES-GCM.
   *
   * @return the algorithm name.
   */
  public String getAlgorithmName() {
    return "AES-" + name();
  }

  /**
   * Returns the suffix of the JWK "alg" value, e.g. GCM for A256GCM.
   *
   * @return the JWK suffix.
   */
  public String getJwkSuffix() {
    return name();
  }

  public static AesMode forAlgorithmName(String algorithmName)
      throws MalformedAlgorithmNameException, NotSupportedException {
    Matcher matcher = algorithmName == null ? null : NAME_PATTERN.matcher(algorithmName);
    if (matcher == null || !matcher.matches()) {
      throw new MalformedAlgorithmNameException(algorithmName);
    }

    String suffix = matcher.group(1);
    for (AesMode mode : values()) {
      if (mode.name().equals(suffix)) {
        return mode;
      }
    }
    throw new NotSupportedException("unsupported algorithm " + algorithmName);
  }

}
