// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

/**
 * The operations of a PKCS#11 token (a session to a PKCS#11 module) this library depends on.
 * Session lifecycle, login and slot selection are the business of the implementation.
 * <p>
 * Implementations decide whether concurrent calls are serialized; the callers of this interface do
 * not add any locking.
 *
 * @author Lijun Liao (xipki)
 */
public interface PKCS11Token {

  /**
   * Get the cryptoki version implemented by the underlying module.
   *
   * @return the cryptoki version.
   * @throws PKCS11Exception If getting the module information failed.
   */
  Version getCryptokiVersion() throws PKCS11Exception;

  /**
   * Generate a new secret key using the set attributes of the template.
   *
   * @param mechanism The mechanism to generate a key for; e.g. CKM_AES_KEY_GEN.
   * @param template  The template for the new key.
   * @return The handle of the newly generated secret key.
   * @throws PKCS11Exception If generating a new secret key failed.
   */
  long generateKey(Mechanism mechanism, AttributeVector template) throws PKCS11Exception;

  /**
   * Create a new object on the token (or in the session).
   *
   * @param template The template object that holds all values that the new object on the token should contain.
   * @return The handle of the new object.
   * @throws PKCS11Exception If the creation of the new object fails.
   */
  long createObject(AttributeVector template) throws PKCS11Exception;

  /**
   * Read the given attributes of an object.
   *
   * @param objectHandle   The object handle.
   * @param attributeTypes The attribute types (CKA_*) to read.
   * @return the attributes with their values.
   * @throws PKCS11Exception If reading the attributes failed, e.g. CKR_ATTRIBUTE_SENSITIVE.
   */
  AttributeVector getAttrValues(long objectHandle, long... attributeTypes) throws PKCS11Exception;

  /**
   * Encrypts the given data in a single part.
   *
   * @param mechanism The mechanism to use.
   * @param keyHandle The encryption key.
   * @param in        the to-be-encrypted data.
   * @param out       buffer for the encrypted data, its length is the output buffer size.
   * @return the length of encrypted data.
   * @throws PKCS11Exception If encrypting failed.
   */
  int encrypt(Mechanism mechanism, long keyHandle, byte[] in, byte[] out) throws PKCS11Exception;

  /**
   * Decrypts the given data in a single part.
   *
   * @param mechanism The mechanism to use.
   * @param keyHandle The decryption key.
   * @param in        the to-be-decrypted data.
   * @param out       buffer for the decrypted data, its length is the output buffer size.
   * @return the length of decrypted data.
   * @throws PKCS11Exception If decrypting failed.
   */
  int decrypt(Mechanism mechanism, long keyHandle, byte[] in, byte[] out) throws PKCS11Exception;

  /**
   * Generates a certain number of random bytes.
   *
   * @param numberOfBytesToGenerate The number of random bytes to generate.
   * @return An array of random bytes with length numberOfBytesToGenerate.
   * @throws PKCS11Exception If generating random bytes failed.
   */
  byte[] generateRandom(int numberOfBytesToGenerate) throws PKCS11Exception;

  /**
   * Destroy the given object.
   *
   * @param objectHandle The object handle.
   * @throws PKCS11Exception If destroying the object fails.
   */
  void destroyObject(long objectHandle) throws PKCS11Exception;

}
