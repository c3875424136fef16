// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

import org.xipki.p11webcrypto.wrapper.params.ByteArrayParams;
import org.xipki.p11webcrypto.wrapper.params.CkParams;
import org.xipki.p11webcrypto.wrapper.params.GCM_PARAMS;
import org.xipki.p11webcrypto.wrapper.params.GCM_PARAMS_V240;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.*;

/**
 * A {@link PKCS11Token} whose objects live in memory and whose AES mechanisms are computed by the
 * JCE. It behaves like a session of a PKCS#11 module: objects are referenced by handles, the
 * attributes CKA_ENCRYPT, CKA_DECRYPT, CKA_SENSITIVE and CKA_EXTRACTABLE are enforced, and errors
 * are reported as {@link PKCS11Exception} with the matching CKR_* code.
 * <p>
 * Supported mechanisms: CKM_AES_KEY_GEN, CKM_AES_ECB, CKM_AES_CBC_PAD and CKM_AES_GCM. For
 * CKM_AES_GCM the parameters must have the shape matching the reported cryptoki version.
 * <p>
 * All methods are synchronized, so concurrent calls are serialized.
 *
 * @author Lijun Liao (xipki)
 */
public class SoftwareToken implements PKCS11Token {

  private static final int AES_BLOCK_SIZE = 16;

  private final Version cryptokiVersion;

  private final SecureRandom random = new SecureRandom();

  private final Map<Long, AttributeVector> objects = new HashMap<>();

  private long nextObjectHandle = 1;

  public SoftwareToken() {
    this(Version.V2_40);
  }

  public SoftwareToken(Version cryptokiVersion) {
    this.cryptokiVersion = Functions.requireNonNull("cryptokiVersion", cryptokiVersion);
  }

  @Override
  public Version getCryptokiVersion() {
    return cryptokiVersion;
  }

  @Override
  public synchronized long generateKey(Mechanism mechanism, AttributeVector template) throws PKCS11Exception {
    final String method = "C_GenerateKey";
    debugIn(method, "mechanism={}, template={}", mechanism, template);
    try {
      if (mechanism.getMechanismCode() != CKM_AES_KEY_GEN) {
        throw new PKCS11Exception(CKR_MECHANISM_INVALID);
      }

      AttributeVector attrs = new AttributeVector(template);
      assertAesSecretKey(attrs);
      if (attrs.hasAttribute(CKA_VALUE)) {
        throw new PKCS11Exception(CKR_TEMPLATE_INCONSISTENT);
      }

      Integer valueLen = attrs.valueLen();
      if (valueLen == null) {
        throw new PKCS11Exception(CKR_TEMPLATE_INCOMPLETE);
      }

      if (!isAesKeySize(valueLen)) {
        throw new PKCS11Exception(CKR_KEY_SIZE_RANGE);
      }

      byte[] value = new byte[valueLen];
      random.nextBytes(value);
      attrs.value(value).attr(CKA_LOCAL, true);
      long hKey = storeObject(attrs);
      debugOut(method, "hKey={}", hKey);
      return hKey;
    } catch (PKCS11Exception ex) {
      debugError(method, ex);
      throw ex;
    }
  }

  @Override
  public synchronized long createObject(AttributeVector template) throws PKCS11Exception {
    final String method = "C_CreateObject";
    AttributeVector attrs = new AttributeVector(template).attributesAsSensitive(CKA_VALUE);
    debugIn(method, "template={}", attrs);
    try {
      assertAesSecretKey(attrs);
      if (attrs.hasAttribute(CKA_VALUE_LEN)) {
        throw new PKCS11Exception(CKR_TEMPLATE_INCONSISTENT);
      }

      byte[] value = attrs.value();
      if (value == null) {
        throw new PKCS11Exception(CKR_TEMPLATE_INCOMPLETE);
      }

      if (!isAesKeySize(value.length)) {
        throw new PKCS11Exception(CKR_ATTRIBUTE_VALUE_INVALID);
      }

      attrs.valueLen(value.length).attr(CKA_LOCAL, false);
      long hObject = storeObject(attrs);
      debugOut(method, "hObject={}", hObject);
      return hObject;
    } catch (PKCS11Exception ex) {
      debugError(method, ex);
      throw ex;
    }
  }

  @Override
  public synchronized AttributeVector getAttrValues(long objectHandle, long... attributeTypes)
      throws PKCS11Exception {
    final String method = "C_GetAttributeValue";
    debugIn(method, "objectHandle={}", objectHandle);
    try {
      AttributeVector attrs = getObject(objectHandle, CKR_OBJECT_HANDLE_INVALID);
      AttributeVector rv = new AttributeVector();
      for (long type : attributeTypes) {
        if (!attrs.hasAttribute(type)) {
          throw new PKCS11Exception(CKR_ATTRIBUTE_TYPE_INVALID);
        }

        if (type == CKA_VALUE) {
          if (Boolean.TRUE.equals(attrs.sensitive()) || !Boolean.TRUE.equals(attrs.extractable())) {
            throw new PKCS11Exception(CKR_ATTRIBUTE_SENSITIVE);
          }
          rv.attributesAsSensitive(CKA_VALUE);
        }

        Object value = attrs.getAttribute(type);
        rv.attr(type, value instanceof byte[] ? ((byte[]) value).clone() : value);
      }
      debugOut(method, "attributes={}", rv);
      return rv;
    } catch (PKCS11Exception ex) {
      debugError(method, ex);
      throw ex;
    }
  }

  @Override
  public synchronized int encrypt(Mechanism mechanism, long keyHandle, byte[] in, byte[] out)
      throws PKCS11Exception {
    return cipher("C_Encrypt", true, mechanism, keyHandle, in, out);
  }

  @Override
  public synchronized int decrypt(Mechanism mechanism, long keyHandle, byte[] in, byte[] out)
      throws PKCS11Exception {
    return cipher("C_Decrypt", false, mechanism, keyHandle, in, out);
  }

  @Override
  public synchronized byte[] generateRandom(int numberOfBytesToGenerate) {
    debugIn("C_GenerateRandom", "numberOfBytesToGenerate={}", numberOfBytesToGenerate);
    byte[] randomBytesBuffer = new byte[numberOfBytesToGenerate];
    random.nextBytes(randomBytesBuffer);
    return randomBytesBuffer;
  }

  @Override
  public synchronized void destroyObject(long objectHandle) throws PKCS11Exception {
    final String method = "C_DestroyObject";
    debugIn(method, "objectHandle={}", objectHandle);
    if (objects.remove(objectHandle) == null) {
      PKCS11Exception ex = new PKCS11Exception(CKR_OBJECT_HANDLE_INVALID);
      debugError(method, ex);
      throw ex;
    }
    debugOut(method);
  }

  private int cipher(String method, boolean encrypt, Mechanism mechanism, long keyHandle, byte[] in, byte[] out)
      throws PKCS11Exception {
    debugIn(method, "keyHandle={}, mechanism={}, inLen={}, outLen={}", keyHandle, mechanism, in.length, out.length);
    try {
      AttributeVector key = getObject(keyHandle, CKR_KEY_HANDLE_INVALID);
      Boolean permitted = encrypt ? key.encrypt() : key.decrypt();
      if (!Boolean.TRUE.equals(permitted)) {
        throw new PKCS11Exception(CKR_KEY_FUNCTION_NOT_PERMITTED);
      }

      long code = mechanism.getMechanismCode();
      if (code == CKM_AES_ECB && in.length % AES_BLOCK_SIZE != 0) {
        throw new PKCS11Exception(encrypt ? CKR_DATA_LEN_RANGE : CKR_ENCRYPTED_DATA_LEN_RANGE);
      }

      Cipher cipher = initCipher(encrypt ? Cipher.ENCRYPT_MODE : Cipher.DECRYPT_MODE, mechanism, key.value());
      byte[] result;
      try {
        result = cipher.doFinal(in);
      } catch (BadPaddingException ex) {
        // also covers AEADBadTagException
        throw new PKCS11Exception(CKR_ENCRYPTED_DATA_INVALID, ex);
      } catch (IllegalBlockSizeException ex) {
        throw new PKCS11Exception(encrypt ? CKR_DATA_LEN_RANGE : CKR_ENCRYPTED_DATA_LEN_RANGE, ex);
      }

      if (result.length > out.length) {
        throw new PKCS11Exception(CKR_BUFFER_TOO_SMALL);
      }

      System.arraycopy(result, 0, out, 0, result.length);
      debugOut(method, "rv={}", result.length);
      return result.length;
    } catch (PKCS11Exception ex) {
      debugError(method, ex);
      throw ex;
    }
  }

  private Cipher initCipher(int opmode, Mechanism mechanism, byte[] keyValue) throws PKCS11Exception {
    long code = mechanism.getMechanismCode();
    CkParams params = mechanism.getParameters();
    SecretKeySpec key = new SecretKeySpec(keyValue, "AES");

    try {
      Cipher cipher;
      if (code == CKM_AES_ECB) {
        if (params != null) {
          throw new PKCS11Exception(CKR_MECHANISM_PARAM_INVALID);
        }
        cipher = Cipher.getInstance("AES/ECB/NoPadding");
        cipher.init(opmode, key);
      } else if (code == CKM_AES_CBC_PAD) {
        if (!(params instanceof ByteArrayParams)) {
          throw new PKCS11Exception(CKR_MECHANISM_PARAM_INVALID);
        }
        cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(opmode, key, new IvParameterSpec(((ByteArrayParams) params).getBytes()));
      } else if (code == CKM_AES_GCM) {
        GCM_PARAMS gcmParams = toGcmParams(params);
        cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(opmode, key, new GCMParameterSpec(gcmParams.getTagBits(), gcmParams.getIv()));
        byte[] aad = gcmParams.getAad();
        if (aad != null) {
          cipher.updateAAD(aad);
        }
      } else {
        throw new PKCS11Exception(CKR_MECHANISM_INVALID);
      }
      return cipher;
    } catch (InvalidAlgorithmParameterException ex) {
      throw new PKCS11Exception(CKR_MECHANISM_PARAM_INVALID, ex);
    } catch (InvalidKeyException ex) {
      throw new PKCS11Exception(CKR_KEY_TYPE_INCONSISTENT, ex);
    } catch (GeneralSecurityException ex) {
      throw new PKCS11Exception(CKR_GENERAL_ERROR, ex);
    }
  }

  private GCM_PARAMS toGcmParams(CkParams params) throws PKCS11Exception {
    boolean v240 = cryptokiVersion.isAtLeast(2, 40);
    if (v240 ? params instanceof GCM_PARAMS_V240
        : params != null && params.getClass() == GCM_PARAMS.class) {
      return (GCM_PARAMS) params;
    }
    throw new PKCS11Exception(CKR_MECHANISM_PARAM_INVALID);
  }

  private AttributeVector getObject(long handle, long errorCode) throws PKCS11Exception {
    AttributeVector attrs = objects.get(handle);
    if (attrs == null) {
      throw new PKCS11Exception(errorCode);
    }
    return attrs;
  }

  private long storeObject(AttributeVector attrs) {
    setDefault(attrs, CKA_TOKEN, false);
    setDefault(attrs, CKA_SENSITIVE, false);
    setDefault(attrs, CKA_EXTRACTABLE, true);
    setDefault(attrs, CKA_ENCRYPT, false);
    setDefault(attrs, CKA_DECRYPT, false);
    attrs.attr(CKA_ALWAYS_SENSITIVE, attrs.sensitive());
    attrs.attr(CKA_NEVER_EXTRACTABLE, !attrs.extractable());
    attrs.attributesAsSensitive(CKA_VALUE);

    long handle = nextObjectHandle++;
    objects.put(handle, attrs);
    return handle;
  }

  private static void setDefault(AttributeVector attrs, long type, Object value) {
    if (attrs.getAttribute(type) == null) {
      attrs.attr(type, value);
    }
  }

  private static void assertAesSecretKey(AttributeVector attrs) throws PKCS11Exception {
    Long objClass = attrs.class_();
    Long keyType = attrs.keyType();
    if (objClass == null || keyType == null) {
      throw new PKCS11Exception(CKR_TEMPLATE_INCOMPLETE);
    }

    if (objClass != CKO_SECRET_KEY || keyType != CKK_AES) {
      throw new PKCS11Exception(CKR_TEMPLATE_INCONSISTENT);
    }
  }

  private static boolean isAesKeySize(int len) {
    return len == 16 || len == 24 || len == 32;
  }

  private void debugIn(String method, String format, Object... arguments) {
    if (StaticLogger.isDebugEnabled()) {
      StaticLogger.debug("IN  " + method + ": " + format, arguments);
    }
  }

  private void debugOut(String method) {
    if (StaticLogger.isDebugEnabled()) {
      StaticLogger.debug("OUT " + method);
    }
  }

  private void debugOut(String method, String format, Object... arguments) {
    if (StaticLogger.isDebugEnabled()) {
      StaticLogger.debug("OUT " + method + ": " + format, arguments);
    }
  }

  private void debugError(String method, PKCS11Exception e) {
    if (StaticLogger.isDebugEnabled()) {
      StaticLogger.debug("ERR " + method + ": " + ckrCodeToName(e.getErrorCode()));
    }
  }

  @Override
  public synchronized String toString() {
    return "SoftwareToken (cryptoki " + cryptokiVersion + ", " + objects.size() + " objects)";
  }

}
