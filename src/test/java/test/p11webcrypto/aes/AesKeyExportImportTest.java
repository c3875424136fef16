// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package test.p11webcrypto.aes;

import org.junit.Assert;
import org.junit.Test;
import org.xipki.p11webcrypto.MalformedAlgorithmNameException;
import org.xipki.p11webcrypto.NotSupportedException;
import org.xipki.p11webcrypto.UnsupportedFormatException;
import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.aes.AesAlgorithm;
import org.xipki.p11webcrypto.aes.AesCipherProvider;
import org.xipki.p11webcrypto.aes.AesKeyAlgorithm;
import org.xipki.p11webcrypto.aes.AesMode;
import org.xipki.p11webcrypto.aes.CryptoKey;
import org.xipki.p11webcrypto.aes.JsonWebKey;
import org.xipki.p11webcrypto.aes.KeyTemplateConfig;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import test.p11webcrypto.TestBase;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKR_ATTRIBUTE_SENSITIVE;
import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.CKR_ATTRIBUTE_VALUE_INVALID;

/**
 * Exports and imports AES keys in the formats raw and jwk.
 */
public class AesKeyExportImportTest extends TestBase {

  @Test
  public void exportJwk() throws Exception {
    CryptoKey key = generateEncryptionKey(AesMode.GCM, 256);
    byte[] raw = provider.exportKey("raw", key);
    Assert.assertEquals(32, raw.length);

    JsonWebKey jwk = provider.exportJwk(key);
    Assert.assertEquals("oct", jwk.getKty());
    Assert.assertEquals("A256GCM", jwk.getAlg());
    Assert.assertEquals(Boolean.TRUE, jwk.getExt());
    Assert.assertFalse(jwk.getK().contains("="));
    Assert.assertArrayEquals(raw, Base64.getUrlDecoder().decode(jwk.getK()));
  }

  @Test
  public void jwkRoundTrip() throws Exception {
    CryptoKey key = generateEncryptionKey(AesMode.CBC, 192);
    byte[] jwk = provider.exportKey("jwk", key);
    LOG.info("exported JWK {}", new String(jwk, StandardCharsets.UTF_8).replaceAll("\"k\":\"[^\"]*\"", "\"k\":..."));

    CryptoKey imported = provider.importKey("jwk", jwk, "AES-CBC", true, usages("encrypt", "decrypt"));
    Assert.assertEquals(new AesKeyAlgorithm(AesMode.CBC, 192), imported.getAlgorithm());
    Assert.assertArrayEquals(provider.exportKey("raw", key), provider.exportKey("raw", imported));

    // the imported key decrypts what the original key encrypted
    byte[] iv = randomBytes(16);
    byte[] data = randomBytes(50);
    byte[] encrypted = provider.encrypt(AesAlgorithm.cbc(iv), key, data);
    Assert.assertArrayEquals(data, provider.decrypt(AesAlgorithm.cbc(iv), imported, encrypted));
  }

  @Test
  public void importRaw() throws Exception {
    byte[] value = randomBytes(16);
    CryptoKey key = provider.importKey("RAW", value, "AES-ECB", true, usages("encrypt"));
    Assert.assertEquals(128, key.getAlgorithm().getLength());
    Assert.assertEquals(AesMode.ECB, key.getAlgorithm().getMode());

    JsonWebKey jwk = provider.exportJwk(key);
    Assert.assertEquals("A128ECB", jwk.getAlg());
    Assert.assertEquals(Base64.getUrlEncoder().withoutPadding().encodeToString(value), jwk.getK());
  }

  @Test
  public void importJwkObject() throws Exception {
    byte[] value = randomBytes(32);
    JsonWebKey jwk = new JsonWebKey("oct", Base64.getUrlEncoder().encodeToString(value), "A256GCM", true);
    CryptoKey key = provider.importJwk(jwk, "AES-GCM", true, usages("encrypt", "decrypt"));
    Assert.assertEquals(256, key.getAlgorithm().getLength());
    Assert.assertArrayEquals(value, provider.exportKey("raw", key));
  }

  @Test
  public void unsupportedFormats() throws Exception {
    CryptoKey key = generateEncryptionKey(AesMode.GCM, 128);
    UnsupportedFormatException ex = Assert.assertThrows(UnsupportedFormatException.class,
        () -> provider.exportKey("der", key));
    Assert.assertEquals("der", ex.getFormat());

    Assert.assertThrows(UnsupportedFormatException.class,
        () -> provider.importKey("spki", new byte[16], "AES-GCM", true, usages("encrypt")));
  }

  @Test
  public void exportNotExtractable() throws Exception {
    CryptoKey key = provider.generateKey(new AesKeyAlgorithm(AesMode.GCM, 128), false, usages("encrypt"));
    WebCryptoException ex = Assert.assertThrows(WebCryptoException.class, () -> provider.exportKey("raw", key));
    Assert.assertEquals("key is not extractable", ex.getMessage());
  }

  @Test
  public void exportSensitiveKey() throws Exception {
    AesCipherProvider sensitiveProvider = newProvider(token, new KeyTemplateConfig(false, true));
    CryptoKey key = sensitiveProvider.generateKey(new AesKeyAlgorithm(AesMode.GCM, 128), true, usages("encrypt"));

    PKCS11Exception ex = Assert.assertThrows(PKCS11Exception.class, () -> sensitiveProvider.exportJwk(key));
    Assert.assertEquals(CKR_ATTRIBUTE_SENSITIVE, ex.getErrorCode());
  }

  @Test
  public void importWithInvalidAlgorithmName() {
    Assert.assertThrows(MalformedAlgorithmNameException.class,
        () -> provider.importKey("raw", new byte[16], "Foo", true, usages("encrypt")));
    Assert.assertThrows(NotSupportedException.class,
        () -> provider.importKey("raw", new byte[16], "AES-CTR", true, usages("encrypt")));
  }

  @Test
  public void importInvalidJwk() {
    byte[] noK = "{\"kty\":\"oct\",\"alg\":\"A128GCM\"}".getBytes(StandardCharsets.UTF_8);
    Assert.assertThrows(WebCryptoException.class,
        () -> provider.importKey("jwk", noK, "AES-GCM", true, usages("encrypt")));

    byte[] notJson = "not a JWK".getBytes(StandardCharsets.UTF_8);
    Assert.assertThrows(WebCryptoException.class,
        () -> provider.importKey("jwk", notJson, "AES-GCM", true, usages("encrypt")));

    JsonWebKey rsa = new JsonWebKey("RSA", "AAAA", null, null);
    Assert.assertThrows(WebCryptoException.class,
        () -> provider.importJwk(rsa, "AES-GCM", true, usages("encrypt")));
  }

  @Test
  public void importInvalidKeyLength() {
    PKCS11Exception ex = Assert.assertThrows(PKCS11Exception.class,
        () -> provider.importKey("raw", new byte[20], "AES-GCM", true, usages("encrypt")));
    Assert.assertEquals(CKR_ATTRIBUTE_VALUE_INVALID, ex.getErrorCode());
  }

}
