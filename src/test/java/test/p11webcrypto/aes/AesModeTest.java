// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package test.p11webcrypto.aes;

import org.junit.Assert;
import org.junit.Test;
import org.xipki.p11webcrypto.MalformedAlgorithmNameException;
import org.xipki.p11webcrypto.NotSupportedException;
import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.aes.AesAlgorithm;
import org.xipki.p11webcrypto.aes.AesMode;

/**
 * Tests the parsing of the algorithm names and the mode flags.
 */
public class AesModeTest {

  @Test
  public void parseAlgorithmNames() throws WebCryptoException {
    Assert.assertEquals(AesMode.GCM, AesMode.forAlgorithmName("AES-GCM"));
    Assert.assertEquals(AesMode.CBC, AesMode.forAlgorithmName("AES-CBC"));
    Assert.assertEquals(AesMode.ECB, AesMode.forAlgorithmName("AES-ECB"));
    Assert.assertEquals(AesMode.CTR, AesMode.forAlgorithmName("AES-CTR"));
  }

  @Test
  public void malformedAlgorithmNames() {
    for (String name : new String[] {"RSA-OAEP", "AES-", "AES_GCM", "aes-gcm", "AES-GCM-256", ""}) {
      Assert.assertThrows(name, MalformedAlgorithmNameException.class, () -> AesMode.forAlgorithmName(name));
    }
    Assert.assertThrows(MalformedAlgorithmNameException.class, () -> AesMode.forAlgorithmName(null));
  }

  @Test
  public void unknownMode() {
    Assert.assertThrows(NotSupportedException.class, () -> AesMode.forAlgorithmName("AES-XTS"));
  }

  @Test
  public void onlyEcbIsPaddedByThisLibrary() {
    for (AesMode mode : AesMode.values()) {
      Assert.assertEquals(mode.name(), mode == AesMode.ECB, mode.isPadding());
    }
  }

  @Test
  public void namesAndSuffixes() {
    Assert.assertEquals("AES-GCM", AesMode.GCM.getAlgorithmName());
    Assert.assertEquals("CBC", AesMode.CBC.getJwkSuffix());
    Assert.assertEquals("AES-ECB", AesAlgorithm.ecb().getName());
  }

  @Test
  public void parameterizedModesNeedParameters() {
    Assert.assertThrows(IllegalArgumentException.class, () -> AesAlgorithm.of(AesMode.GCM));
    Assert.assertThrows(IllegalArgumentException.class, () -> AesAlgorithm.of(AesMode.CBC));
    Assert.assertEquals(AesMode.CTR, AesAlgorithm.of(AesMode.CTR).getMode());
  }

}
