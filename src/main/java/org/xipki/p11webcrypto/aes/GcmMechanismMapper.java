// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.Version;
import org.xipki.p11webcrypto.wrapper.params.GCM_PARAMS;
import org.xipki.p11webcrypto.wrapper.params.GCM_PARAMS_V240;

import java.util.Arrays;
import java.util.List;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKM_AES_GCM;

/**
 * Maps AES-GCM to CKM_AES_GCM. Modules implementing cryptoki 2.40 or later receive the
 * CK_GCM_PARAMS with ulIvBits, older modules the structure without it.
 *
 * @author Lijun Liao (xipki)
 */
public class GcmMechanismMapper implements MechanismMapper {

  public static final int DEFAULT_TAG_LENGTH = 128;

  private static final List<Integer> TAG_LENGTHS = Arrays.asList(32, 64, 96, 104, 112, 120, 128);

  @Override
  public Mechanism toMechanism(AesAlgorithm algorithm, Version cryptokiVersion) throws WebCryptoException {
    if (!(algorithm instanceof AesGcmParams)) {
      throw new WebCryptoException(algorithm.getName() + " requires AES-GCM parameters");
    }

    AesGcmParams params = (AesGcmParams) algorithm;
    int tagLength = params.getTagLength() == null ? DEFAULT_TAG_LENGTH : params.getTagLength();
    if (!TAG_LENGTHS.contains(tagLength)) {
      throw new WebCryptoException("invalid AES-GCM tag length " + tagLength);
    }

    GCM_PARAMS gcmParams = cryptokiVersion.isAtLeast(2, 40)
        ? new GCM_PARAMS_V240(params.getIv(), params.getAdditionalData(), tagLength)
        : new GCM_PARAMS(params.getIv(), params.getAdditionalData(), tagLength);
    return new Mechanism(CKM_AES_GCM, gcmParams);
  }

}
