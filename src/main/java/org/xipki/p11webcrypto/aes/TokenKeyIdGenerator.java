// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import org.xipki.p11webcrypto.wrapper.PKCS11Token;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Generates the id as SHA-1 digest over 10 random bytes drawn from the token.
 *
 * @author Lijun Liao (xipki)
 */
public class TokenKeyIdGenerator implements KeyIdGenerator {

  private static final int RANDOM_LEN = 10;

  private final PKCS11Token token;

  public TokenKeyIdGenerator(PKCS11Token token) {
    this.token = Functions.requireNonNull("token", token);
  }

  @Override
  public byte[] generateId() throws PKCS11Exception {
    byte[] random = token.generateRandom(RANDOM_LEN);
    try {
      return MessageDigest.getInstance("SHA-1").digest(random);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 is not available", ex);
    }
  }

}
