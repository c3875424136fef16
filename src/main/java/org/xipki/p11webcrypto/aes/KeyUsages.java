// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

/**
 * The WebCrypto key usages. Compared case-sensitively.
 *
 * @author Lijun Liao (xipki)
 */
public class KeyUsages {

  public static final String SIGN = "sign";

  public static final String VERIFY = "verify";

  public static final String ENCRYPT = "encrypt";

  public static final String DECRYPT = "decrypt";

  public static final String WRAP_KEY = "wrapKey";

  public static final String UNWRAP_KEY = "unwrapKey";

  private KeyUsages() {
  }

}
