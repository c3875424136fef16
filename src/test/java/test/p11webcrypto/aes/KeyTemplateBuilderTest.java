// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package test.p11webcrypto.aes;

import org.junit.Assert;
import org.junit.Test;
import org.xipki.p11webcrypto.aes.AesKeyAlgorithm;
import org.xipki.p11webcrypto.aes.AesMode;
import org.xipki.p11webcrypto.aes.KeyIdGenerator;
import org.xipki.p11webcrypto.aes.KeyTemplateBuilder;
import org.xipki.p11webcrypto.aes.KeyTemplateConfig;
import org.xipki.p11webcrypto.aes.TokenKeyIdGenerator;
import org.xipki.p11webcrypto.wrapper.AttributeVector;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import org.xipki.p11webcrypto.wrapper.SoftwareToken;

import java.util.Arrays;
import java.util.Collections;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.*;

/**
 * Tests the template of the AES keys.
 */
public class KeyTemplateBuilderTest {

  private static final byte[] ID = {1, 2, 3, 4};

  private static final KeyIdGenerator FIXED_ID = () -> ID.clone();

  @Test
  public void encryptDecryptUsages() throws PKCS11Exception {
    AttributeVector template = new KeyTemplateBuilder(KeyTemplateConfig.DEFAULT).build(FIXED_ID,
        new AesKeyAlgorithm(AesMode.CBC, 256), true, Arrays.asList("encrypt", "decrypt"));

    Assert.assertEquals(CKO_SECRET_KEY, (long) template.class_());
    Assert.assertEquals(CKK_AES, (long) template.keyType());
    Assert.assertEquals("AES-256", template.label());
    Assert.assertArrayEquals(ID, template.id());
    Assert.assertEquals(Boolean.FALSE, template.token());
    Assert.assertEquals(Boolean.FALSE, template.sensitive());
    Assert.assertEquals(Boolean.TRUE, template.extractable());
    Assert.assertEquals(Boolean.FALSE, template.derive());

    Assert.assertEquals(Boolean.TRUE, template.encrypt());
    Assert.assertEquals(Boolean.TRUE, template.decrypt());
    Assert.assertEquals(Boolean.FALSE, template.sign());
    Assert.assertEquals(Boolean.FALSE, template.verify());
    Assert.assertEquals(Boolean.FALSE, template.wrap());
    Assert.assertEquals(Boolean.FALSE, template.unwrap());

    Assert.assertFalse(template.hasAttribute(CKA_VALUE));
    Assert.assertFalse(template.hasAttribute(CKA_VALUE_LEN));
  }

  @Test
  public void wrapUnwrapSignVerifyUsages() throws PKCS11Exception {
    AttributeVector template = new KeyTemplateBuilder(KeyTemplateConfig.DEFAULT).build(FIXED_ID,
        new AesKeyAlgorithm(AesMode.GCM, 128), false, Arrays.asList("wrapKey", "unwrapKey", "sign", "verify"));

    Assert.assertEquals("AES-128", template.label());
    Assert.assertEquals(Boolean.FALSE, template.extractable());
    Assert.assertEquals(Boolean.TRUE, template.wrap());
    Assert.assertEquals(Boolean.TRUE, template.unwrap());
    Assert.assertEquals(Boolean.TRUE, template.sign());
    Assert.assertEquals(Boolean.TRUE, template.verify());
    Assert.assertEquals(Boolean.FALSE, template.encrypt());
    Assert.assertEquals(Boolean.FALSE, template.decrypt());
  }

  @Test
  public void usagesAreCaseSensitive() throws PKCS11Exception {
    AttributeVector template = new KeyTemplateBuilder(KeyTemplateConfig.DEFAULT).build(FIXED_ID,
        new AesKeyAlgorithm(AesMode.ECB, 192), true, Arrays.asList("Encrypt", "DECRYPT", "wrap", "unwrapkey"));

    Assert.assertEquals(Boolean.FALSE, template.encrypt());
    Assert.assertEquals(Boolean.FALSE, template.decrypt());
    Assert.assertEquals(Boolean.FALSE, template.wrap());
    Assert.assertEquals(Boolean.FALSE, template.unwrap());
  }

  @Test
  public void noUsages() throws PKCS11Exception {
    AttributeVector template = new KeyTemplateBuilder(KeyTemplateConfig.DEFAULT).build(FIXED_ID,
        new AesKeyAlgorithm(AesMode.ECB, 128), true, Collections.emptyList());

    for (long type : new long[] {CKA_SIGN, CKA_VERIFY, CKA_ENCRYPT, CKA_DECRYPT, CKA_WRAP, CKA_UNWRAP}) {
      Assert.assertEquals(ckaCodeToName(type), Boolean.FALSE, template.getAttribute(type));
    }
  }

  @Test
  public void tokenAndSensitiveFromConfig() throws PKCS11Exception {
    AttributeVector template = new KeyTemplateBuilder(new KeyTemplateConfig(true, true)).build(FIXED_ID,
        new AesKeyAlgorithm(AesMode.GCM, 256), true, Collections.singletonList("encrypt"));

    Assert.assertEquals(Boolean.TRUE, template.token());
    Assert.assertEquals(Boolean.TRUE, template.sensitive());
    // the caller's flag is kept, the token enforces sensitivity
    Assert.assertEquals(Boolean.TRUE, template.extractable());
  }

  @Test
  public void idFromTokenRandom() throws PKCS11Exception {
    TokenKeyIdGenerator generator = new TokenKeyIdGenerator(new SoftwareToken());
    byte[] id1 = generator.generateId();
    byte[] id2 = generator.generateId();
    Assert.assertEquals(20, id1.length);
    Assert.assertFalse(Arrays.equals(id1, id2));
  }

}
