// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.Version;

/**
 * Translates the algorithm descriptor of one AES mode to the PKCS#11 mechanism.
 *
 * @author Lijun Liao (xipki)
 */
public interface MechanismMapper {

  /**
   * Returns the mechanism for the given descriptor.
   *
   * @param algorithm       the algorithm descriptor, its mode is the mode of this mapper.
   * @param cryptokiVersion the cryptoki version of the module the mechanism is passed to.
   * @return the mechanism.
   * @throws WebCryptoException if the descriptor has invalid parameters.
   */
  Mechanism toMechanism(AesAlgorithm algorithm, Version cryptokiVersion) throws WebCryptoException;

}
