// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto;

/**
 * The requested algorithm or mode is not supported.
 *
 * @author Lijun Liao (xipki)
 */
public class NotSupportedException extends WebCryptoException {

  public NotSupportedException(String message) {
    super(message);
  }

}
