// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto;

/**
 * An algorithm name does not have the form {@code AES-<MODE>}.
 *
 * @author Lijun Liao (xipki)
 */
public class MalformedAlgorithmNameException extends WebCryptoException {

  public MalformedAlgorithmNameException(String algorithmName) {
    super("malformed algorithm name '" + algorithmName + "'");
  }

}
