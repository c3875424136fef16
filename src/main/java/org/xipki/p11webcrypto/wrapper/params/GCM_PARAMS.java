// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper.params;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * Represents the CK_GCM_PARAMS as used by modules implementing a cryptoki version before 2.40,
 * without the field ulIvBits.
 *
 * @author Lijun Liao (xipki)
 */
public class GCM_PARAMS extends CkParams {

  protected final byte[] iv;
  protected final byte[] aad;
  protected final int tagBits;

  public GCM_PARAMS(byte[] iv, byte[] aad, int tagBits) {
    this.iv = Functions.copyOf(requireNonNull("iv", iv));
    this.aad = Functions.copyOf(aad);
    this.tagBits = tagBits;
  }

  public byte[] getIv() {
    return iv.clone();
  }

  /**
   * Returns the additional authenticated data.
   *
   * @return the additional authenticated data, may be null.
   */
  public byte[] getAad() {
    return Functions.copyOf(aad);
  }

  public int getTagBits() {
    return tagBits;
  }

  @Override
  public String getStructName() {
    return "CK_GCM_PARAMS";
  }

  @Override
  protected int getMaxFieldLen() {
    return 9; // ulTagBits
  }

  @Override
  public String toString(String indent) {
    return indent + getStructName() + ":" +
        ptr2str(indent, "pIv", iv) +
        ptr2str(indent, "pAAD", aad) +
        val2Str(indent, "ulTagBits", tagBits);
  }

}
