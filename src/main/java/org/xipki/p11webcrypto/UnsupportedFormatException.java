// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto;

/**
 * The key format requested for export or import is unknown.
 *
 * @author Lijun Liao (xipki)
 */
public class UnsupportedFormatException extends WebCryptoException {

  private final String format;

  public UnsupportedFormatException(String format) {
    super("Unknown format '" + format + "'");
    this.format = format;
  }

  public String getFormat() {
    return format;
  }

}
