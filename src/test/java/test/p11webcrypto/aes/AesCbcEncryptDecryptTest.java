// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package test.p11webcrypto.aes;

import org.junit.Assert;
import org.junit.Test;
import org.xipki.p11webcrypto.aes.AesAlgorithm;
import org.xipki.p11webcrypto.aes.AesKeyAlgorithm;
import org.xipki.p11webcrypto.aes.AesMode;
import org.xipki.p11webcrypto.aes.CryptoKey;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import test.p11webcrypto.TestBase;

import java.util.Arrays;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKR_KEY_FUNCTION_NOT_PERMITTED;

/**
 * Encrypts and decrypts with AES-CBC, the data is padded by the token.
 */
public class AesCbcEncryptDecryptTest extends TestBase {

  private final byte[] iv = randomBytes(16);

  @Test
  public void encryptDecrypt() throws Exception {
    for (int keyLength : new int[] {128, 192, 256}) {
      CryptoKey key = generateEncryptionKey(AesMode.CBC, keyLength);
      for (int len : new int[] {0, 16, 33, 1517}) {
        byte[] data = randomBytes(len);
        byte[] encrypted = provider.encrypt(AesAlgorithm.cbc(iv), key, data);
        Assert.assertEquals((len / 16 + 1) * 16, encrypted.length);
        Assert.assertArrayEquals(data, provider.decrypt(AesAlgorithm.cbc(iv), key, encrypted));
      }
    }
  }

  @Test
  public void decryptWithOtherIv() throws Exception {
    CryptoKey key = generateEncryptionKey(AesMode.CBC, 256);
    byte[] data = randomBytes(48);
    byte[] encrypted = provider.encrypt(AesAlgorithm.cbc(iv), key, data);

    byte[] otherIv = iv.clone();
    otherIv[5] ^= 0x10;
    byte[] decrypted = provider.decrypt(AesAlgorithm.cbc(otherIv), key, encrypted);
    Assert.assertFalse(Arrays.equals(data, decrypted));
    // only the first block depends on the IV
    Assert.assertArrayEquals(Arrays.copyOfRange(data, 16, 48), Arrays.copyOfRange(decrypted, 16, 48));
  }

  @Test
  public void keyWithoutEncryptUsage() throws Exception {
    CryptoKey key = provider.generateKey(new AesKeyAlgorithm(AesMode.CBC, 128), false, usages("decrypt"));
    PKCS11Exception ex = Assert.assertThrows(PKCS11Exception.class,
        () -> provider.encrypt(AesAlgorithm.cbc(iv), key, new byte[16]));
    Assert.assertEquals(CKR_KEY_FUNCTION_NOT_PERMITTED, ex.getErrorCode());
  }

}
