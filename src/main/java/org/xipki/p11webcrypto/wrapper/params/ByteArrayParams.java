// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper.params;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * This class encapsulates parameters byte arrays, e.g. the IV of CKM_AES_CBC_PAD.
 *
 * @author Lijun Liao (xipki)
 */
public class ByteArrayParams extends CkParams {

  /**
   * The PKCS#11 object.
   */
  protected final byte[] bytes;

  public ByteArrayParams(byte[] bytes) {
    this.bytes = Functions.copyOf(requireNonNull("bytes", bytes));
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  @Override
  public String getStructName() {
    return "CK_BYTE_ARRAY";
  }

  @Override
  protected int getMaxFieldLen() {
    return 0;
  }

  @Override
  public String toString(String indent) {
    return indent + "ByteArray Params: " + Functions.toHex(bytes);
  }

}
