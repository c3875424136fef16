// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto;

/**
 * Exception thrown by the WebCrypto layer. Subclasses name the specific failure; this class
 * itself is used for operation, data and access errors.
 *
 * @author Lijun Liao (xipki)
 */
public class WebCryptoException extends Exception {

  public WebCryptoException(String message) {
    super(message);
  }

  public WebCryptoException(String message, Throwable cause) {
    super(message, cause);
  }

}
