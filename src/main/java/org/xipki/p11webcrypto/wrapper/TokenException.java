// Copyright (c) 2002 Graz University of Technology. All rights reserved.
// License IAIK PKCS#11 Wrapper License.
//
// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

/**
 * The base class for all exceptions thrown by a token.
 *
 * @author Karl Scheibelhofer (SIC)
 * @author Lijun Liao (xipki)
 */
public class TokenException extends Exception {

  public TokenException(String message) {
    super(message);
  }

  public TokenException(Throwable cause) {
    super(cause);
  }

  public TokenException(String message, Throwable cause) {
    super(message, cause);
  }

}
