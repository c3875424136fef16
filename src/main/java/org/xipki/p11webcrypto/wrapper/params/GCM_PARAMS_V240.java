// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper.params;

/**
 * Represents the CK_GCM_PARAMS as defined since cryptoki version 2.40, with the field ulIvBits.
 *
 * @author Lijun Liao (xipki)
 */
public class GCM_PARAMS_V240 extends GCM_PARAMS {

  private final long ivBits;

  public GCM_PARAMS_V240(byte[] iv, byte[] aad, int tagBits) {
    super(iv, aad, tagBits);
    this.ivBits = (long) this.iv.length * 8;
  }

  public long getIvBits() {
    return ivBits;
  }

  @Override
  public String toString(String indent) {
    return indent + getStructName() + " (v2.40):" +
        ptr2str(indent, "pIv", iv) +
        val2Str(indent, "ulIvBits", ivBits) +
        ptr2str(indent, "pAAD", aad) +
        val2Str(indent, "ulTagBits", tagBits);
  }

}
