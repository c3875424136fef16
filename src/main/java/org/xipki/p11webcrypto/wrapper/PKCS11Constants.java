// Copyright (c) 2002 Graz University of Technology. All rights reserved.
// License IAIK PKCS#11 Wrapper License.
//
// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Constants as defined in PKCS#11 (pkcs11t.h), restricted to the secret-key
 * objects, AES mechanisms and return values this library deals with.
 *
 * @author Karl Scheibelhofer (SIC)
 * @author Lijun Liao (xipki)
 */
public class PKCS11Constants {

  public enum Category {
    CKA,
    CKK,
    CKM,
    CKO,
    CKR
  }

  // object classes
  public static final long CKO_DATA = 0x00000000L;
  public static final long CKO_CERTIFICATE = 0x00000001L;
  public static final long CKO_PUBLIC_KEY = 0x00000002L;
  public static final long CKO_PRIVATE_KEY = 0x00000003L;
  public static final long CKO_SECRET_KEY = 0x00000004L;

  // key types
  public static final long CKK_GENERIC_SECRET = 0x00000010L;
  public static final long CKK_AES = 0x0000001FL;

  // attributes
  public static final long CKA_CLASS = 0x00000000L;
  public static final long CKA_TOKEN = 0x00000001L;
  public static final long CKA_PRIVATE = 0x00000002L;
  public static final long CKA_LABEL = 0x00000003L;
  public static final long CKA_VALUE = 0x00000011L;
  public static final long CKA_KEY_TYPE = 0x00000100L;
  public static final long CKA_ID = 0x00000102L;
  public static final long CKA_SENSITIVE = 0x00000103L;
  public static final long CKA_ENCRYPT = 0x00000104L;
  public static final long CKA_DECRYPT = 0x00000105L;
  public static final long CKA_WRAP = 0x00000106L;
  public static final long CKA_UNWRAP = 0x00000107L;
  public static final long CKA_SIGN = 0x00000108L;
  public static final long CKA_VERIFY = 0x0000010AL;
  public static final long CKA_DERIVE = 0x0000010CL;
  public static final long CKA_VALUE_LEN = 0x00000161L;
  public static final long CKA_EXTRACTABLE = 0x00000162L;
  public static final long CKA_LOCAL = 0x00000163L;
  public static final long CKA_NEVER_EXTRACTABLE = 0x00000164L;
  public static final long CKA_ALWAYS_SENSITIVE = 0x00000165L;

  // mechanisms
  public static final long CKM_AES_KEY_GEN = 0x00001080L;
  public static final long CKM_AES_ECB = 0x00001081L;
  public static final long CKM_AES_CBC = 0x00001082L;
  public static final long CKM_AES_CBC_PAD = 0x00001085L;
  public static final long CKM_AES_CTR = 0x00001086L;
  public static final long CKM_AES_GCM = 0x00001087L;
  public static final long CKM_AES_KEY_WRAP = 0x00002109L;

  // return values
  public static final long CKR_OK = 0x00000000L;
  public static final long CKR_GENERAL_ERROR = 0x00000005L;
  public static final long CKR_ARGUMENTS_BAD = 0x00000007L;
  public static final long CKR_ATTRIBUTE_SENSITIVE = 0x00000011L;
  public static final long CKR_ATTRIBUTE_TYPE_INVALID = 0x00000012L;
  public static final long CKR_ATTRIBUTE_VALUE_INVALID = 0x00000013L;
  public static final long CKR_DATA_INVALID = 0x00000020L;
  public static final long CKR_DATA_LEN_RANGE = 0x00000021L;
  public static final long CKR_DEVICE_ERROR = 0x00000030L;
  public static final long CKR_ENCRYPTED_DATA_INVALID = 0x00000040L;
  public static final long CKR_ENCRYPTED_DATA_LEN_RANGE = 0x00000041L;
  public static final long CKR_KEY_HANDLE_INVALID = 0x00000060L;
  public static final long CKR_KEY_SIZE_RANGE = 0x00000062L;
  public static final long CKR_KEY_TYPE_INCONSISTENT = 0x00000063L;
  public static final long CKR_KEY_FUNCTION_NOT_PERMITTED = 0x00000068L;
  public static final long CKR_MECHANISM_INVALID = 0x00000070L;
  public static final long CKR_MECHANISM_PARAM_INVALID = 0x00000071L;
  public static final long CKR_OBJECT_HANDLE_INVALID = 0x00000082L;
  public static final long CKR_TEMPLATE_INCOMPLETE = 0x000000D0L;
  public static final long CKR_TEMPLATE_INCONSISTENT = 0x000000D1L;
  public static final long CKR_BUFFER_TOO_SMALL = 0x00000150L;

  private static final Map<Category, Map<Long, String>> codeNameMaps = new EnumMap<>(Category.class);

  static {
    for (Category category : Category.values()) {
      codeNameMaps.put(category, new HashMap<>());
    }

    for (Field field : PKCS11Constants.class.getFields()) {
      int modifiers = field.getModifiers();
      if (field.getType() != long.class || !Modifier.isStatic(modifiers)) {
        continue;
      }

      String name = field.getName();
      Category category = Category.valueOf(name.substring(0, name.indexOf('_')));
      try {
        codeNameMaps.get(category).put(field.getLong(null), name);
      } catch (IllegalAccessException ex) {
        throw new IllegalStateException("could not read field " + name, ex);
      }
    }
  }

  private PKCS11Constants() {
  }

  public static String codeToName(Category category, long code) {
    String name = codeNameMaps.get(category).get(code);
    return name != null ? name : "0x" + Functions.toHex(longToBytes(code));
  }

  public static String ckaCodeToName(long code) {
    return codeToName(Category.CKA, code);
  }

  public static String ckmCodeToName(long code) {
    return codeToName(Category.CKM, code);
  }

  public static String ckrCodeToName(long code) {
    return codeToName(Category.CKR, code);
  }

  private static byte[] longToBytes(long value) {
    return new byte[] {(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
  }

}
