// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package test.p11webcrypto.aes;

import org.junit.Assert;
import org.junit.Test;
import org.xipki.p11webcrypto.KeyGenerationException;
import org.xipki.p11webcrypto.NotSupportedException;
import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.aes.AesCipherProvider;
import org.xipki.p11webcrypto.aes.AesKeyAlgorithm;
import org.xipki.p11webcrypto.aes.AesMode;
import org.xipki.p11webcrypto.aes.CryptoKey;
import org.xipki.p11webcrypto.aes.KeyTemplateConfig;
import org.xipki.p11webcrypto.wrapper.AttributeVector;
import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import org.xipki.p11webcrypto.wrapper.SoftwareToken;
import test.p11webcrypto.TestBase;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.*;

/**
 * Generates AES keys in the token.
 */
public class AesKeyGenerationTest extends TestBase {

  @Test
  public void generateCbcKey() throws Exception {
    CryptoKey key = provider.generateKey(new AesKeyAlgorithm(AesMode.CBC, 256), true,
        usages("encrypt", "decrypt"));

    Assert.assertEquals(new AesKeyAlgorithm(AesMode.CBC, 256), key.getAlgorithm());
    Assert.assertEquals("AES-CBC", key.getAlgorithm().getName());
    Assert.assertTrue(key.isExtractable());
    Assert.assertEquals(usages("encrypt", "decrypt"), key.getUsages());

    AttributeVector attrs = token.getAttrValues(key.getHandle(), CKA_ENCRYPT, CKA_DECRYPT, CKA_SIGN,
        CKA_VERIFY, CKA_WRAP, CKA_UNWRAP, CKA_DERIVE, CKA_LABEL, CKA_VALUE_LEN, CKA_TOKEN, CKA_ID);
    Assert.assertEquals(Boolean.TRUE, attrs.encrypt());
    Assert.assertEquals(Boolean.TRUE, attrs.decrypt());
    Assert.assertEquals(Boolean.FALSE, attrs.sign());
    Assert.assertEquals(Boolean.FALSE, attrs.verify());
    Assert.assertEquals(Boolean.FALSE, attrs.wrap());
    Assert.assertEquals(Boolean.FALSE, attrs.unwrap());
    Assert.assertEquals(Boolean.FALSE, attrs.derive());
    Assert.assertEquals(Boolean.FALSE, attrs.token());
    Assert.assertEquals("AES-256", attrs.label());
    Assert.assertEquals(Integer.valueOf(32), attrs.valueLen());
    Assert.assertEquals(20, attrs.id().length);
  }

  @Test
  public void supportedModes() {
    Assert.assertTrue(provider.isSupported(AesMode.GCM));
    Assert.assertTrue(provider.isSupported(AesMode.CBC));
    Assert.assertTrue(provider.isSupported(AesMode.ECB));
    Assert.assertFalse(provider.isSupported(AesMode.CTR));
    Assert.assertFalse(provider.isSupported(AesMode.KW));
  }

  @Test
  public void generateTokenKey() throws Exception {
    AesCipherProvider tokenProvider = newProvider(token, new KeyTemplateConfig(true, false));
    CryptoKey key = tokenProvider.generateKey(new AesKeyAlgorithm(AesMode.GCM, 128), false, usages("encrypt"));
    Assert.assertEquals(Boolean.TRUE, token.getAttrValues(key.getHandle(), CKA_TOKEN).token());
  }

  @Test
  public void invalidKeyLength() {
    Assert.assertThrows(WebCryptoException.class,
        () -> provider.generateKey(new AesKeyAlgorithm(AesMode.GCM, 100), true, usages("encrypt")));
  }

  @Test
  public void unmappedModeIsNotSupported() {
    Assert.assertThrows(NotSupportedException.class,
        () -> provider.generateKey(new AesKeyAlgorithm(AesMode.CTR, 128), true, usages("encrypt")));
    Assert.assertThrows(NotSupportedException.class,
        () -> provider.generateKey(new AesKeyAlgorithm(AesMode.KW, 256), true, usages("wrapKey")));
  }

  @Test
  public void tokenRejectsGeneration() {
    SoftwareToken failingToken = new SoftwareToken() {
      @Override
      public synchronized long generateKey(Mechanism mechanism, AttributeVector template) throws PKCS11Exception {
        throw new PKCS11Exception(CKR_DEVICE_ERROR);
      }
    };

    AesCipherProvider failingProvider = newProvider(failingToken, KeyTemplateConfig.DEFAULT);
    KeyGenerationException ex = Assert.assertThrows(KeyGenerationException.class,
        () -> failingProvider.generateKey(new AesKeyAlgorithm(AesMode.ECB, 128), true, usages("encrypt")));
    Assert.assertEquals("Aes: Can not generate new key\nCKR_DEVICE_ERROR", ex.getMessage());
    Assert.assertEquals(CKR_DEVICE_ERROR, ((PKCS11Exception) ex.getCause()).getErrorCode());
  }

}
