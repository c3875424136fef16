// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.PKCS11Exception;

/**
 * Generator of the CKA_ID of new key objects.
 *
 * @author Lijun Liao (xipki)
 */
public interface KeyIdGenerator {

  byte[] generateId() throws PKCS11Exception;

}
