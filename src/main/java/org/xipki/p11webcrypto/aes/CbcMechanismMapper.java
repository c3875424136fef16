// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.Version;
import org.xipki.p11webcrypto.wrapper.params.ByteArrayParams;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKM_AES_CBC_PAD;

/**
 * Maps AES-CBC to CKM_AES_CBC_PAD, the token pads.
 *
 * @author Lijun Liao (xipki)
 */
public class CbcMechanismMapper implements MechanismMapper {

  @Override
  public Mechanism toMechanism(AesAlgorithm algorithm, Version cryptokiVersion) throws WebCryptoException {
    if (!(algorithm instanceof AesCbcParams)) {
      throw new WebCryptoException(algorithm.getName() + " requires AES-CBC parameters");
    }
    return new Mechanism(CKM_AES_CBC_PAD, new ByteArrayParams(((AesCbcParams) algorithm).getIv()));
  }

}
