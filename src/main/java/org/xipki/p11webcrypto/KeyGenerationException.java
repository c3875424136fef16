// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto;

/**
 * The token rejected the generation of a key.
 *
 * @author Lijun Liao (xipki)
 */
public class KeyGenerationException extends WebCryptoException {

  public KeyGenerationException(String message, Throwable cause) {
    super(message, cause);
  }

}
