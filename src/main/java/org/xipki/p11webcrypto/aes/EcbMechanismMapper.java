// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.Version;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKM_AES_ECB;

/**
 * Maps AES-ECB to CKM_AES_ECB. The mechanism does not pad, see {@link AesMode#isPadding()}.
 *
 * @author Lijun Liao (xipki)
 */
public class EcbMechanismMapper implements MechanismMapper {

  @Override
  public Mechanism toMechanism(AesAlgorithm algorithm, Version cryptokiVersion) {
    return new Mechanism(CKM_AES_ECB);
  }

}
