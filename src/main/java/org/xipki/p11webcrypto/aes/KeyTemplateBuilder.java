// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.AttributeVector;
import org.xipki.p11webcrypto.wrapper.Functions;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;

import java.util.Collection;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKK_AES;

/**
 * Builds the template of AES secret key objects. A usage attribute is true only if its usage
 * has been requested.
 *
 * @author Lijun Liao (xipki)
 */
public class KeyTemplateBuilder {

  private final KeyTemplateConfig config;

  public KeyTemplateBuilder(KeyTemplateConfig config) {
    this.config = Functions.requireNonNull("config", config);
  }

  public AttributeVector build(KeyIdGenerator idGenerator, AesKeyAlgorithm algorithm, boolean extractable,
                               Collection<String> usages) throws PKCS11Exception {
    return AttributeVector.newSecretKey(CKK_AES)
        .token(config.isToken())
        .sensitive(config.isSensitive())
        .label("AES-" + algorithm.getLength())
        .id(idGenerator.generateId())
        .extractable(extractable)
        .derive(false)
        .sign(usages.contains(KeyUsages.SIGN))
        .verify(usages.contains(KeyUsages.VERIFY))
        .encrypt(usages.contains(KeyUsages.ENCRYPT))
        .decrypt(usages.contains(KeyUsages.DECRYPT))
        .wrap(usages.contains(KeyUsages.WRAP_KEY))
        .unwrap(usages.contains(KeyUsages.UNWRAP_KEY));
  }

}
