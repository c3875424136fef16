// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.*;

/**
 * Ordered set of attributes describing an object, used both as template to create or generate
 * objects and as result of reading attributes from an object.
 *
 * <pre>
 * <code>
 *   AttributeVector template = AttributeVector.newSecretKey(CKK_AES)
 *       .token(false).valueLen(16).encrypt(true).decrypt(true);
 * </code>
 * </pre>
 *
 * @author Lijun Liao (xipki)
 */
public class AttributeVector {

  private final Map<Long, Object> attributes = new LinkedHashMap<>();

  private final Set<Long> sensitiveTypes = new HashSet<>();

  public AttributeVector() {
  }

  public AttributeVector(AttributeVector other) {
    for (Map.Entry<Long, Object> entry : other.attributes.entrySet()) {
      Object value = entry.getValue();
      attributes.put(entry.getKey(), value instanceof byte[] ? ((byte[]) value).clone() : value);
    }
    sensitiveTypes.addAll(other.sensitiveTypes);
  }

  public static AttributeVector newSecretKey(long keyType) {
    return new AttributeVector().class_(CKO_SECRET_KEY).keyType(keyType);
  }

  public AttributeVector attr(long type, Object value) {
    attributes.put(type, value);
    return this;
  }

  public Object getAttribute(long type) {
    return attributes.get(type);
  }

  public boolean hasAttribute(long type) {
    return attributes.containsKey(type);
  }

  /**
   * Marks the given attributes as sensitive: their values are masked in {@link #toString()}.
   *
   * @param types the attribute types.
   * @return this object.
   */
  public AttributeVector attributesAsSensitive(long... types) {
    for (long type : types) {
      sensitiveTypes.add(type);
    }
    return this;
  }

  private Boolean getBooleanAttrValue(long type) {
    return (Boolean) attributes.get(type);
  }

  private Long getLongAttrValue(long type) {
    return (Long) attributes.get(type);
  }

  private byte[] getByteArrayAttrValue(long type) {
    return (byte[]) attributes.get(type);
  }

  public Long class_() {
    return getLongAttrValue(CKA_CLASS);
  }

  public AttributeVector class_(long class_) {
    return attr(CKA_CLASS, class_);
  }

  public Long keyType() {
    return getLongAttrValue(CKA_KEY_TYPE);
  }

  public AttributeVector keyType(long keyType) {
    return attr(CKA_KEY_TYPE, keyType);
  }

  public Boolean token() {
    return getBooleanAttrValue(CKA_TOKEN);
  }

  public AttributeVector token(Boolean token) {
    return attr(CKA_TOKEN, token);
  }

  public Boolean sensitive() {
    return getBooleanAttrValue(CKA_SENSITIVE);
  }

  public AttributeVector sensitive(Boolean sensitive) {
    return attr(CKA_SENSITIVE, sensitive);
  }

  public String label() {
    return (String) attributes.get(CKA_LABEL);
  }

  public AttributeVector label(String label) {
    return attr(CKA_LABEL, label);
  }

  public byte[] id() {
    return getByteArrayAttrValue(CKA_ID);
  }

  public AttributeVector id(byte[] id) {
    return attr(CKA_ID, id);
  }

  public Boolean extractable() {
    return getBooleanAttrValue(CKA_EXTRACTABLE);
  }

  public AttributeVector extractable(Boolean extractable) {
    return attr(CKA_EXTRACTABLE, extractable);
  }

  public Boolean derive() {
    return getBooleanAttrValue(CKA_DERIVE);
  }

  public AttributeVector derive(Boolean derive) {
    return attr(CKA_DERIVE, derive);
  }

  public Boolean sign() {
    return getBooleanAttrValue(CKA_SIGN);
  }

  public AttributeVector sign(Boolean sign) {
    return attr(CKA_SIGN, sign);
  }

  public Boolean verify() {
    return getBooleanAttrValue(CKA_VERIFY);
  }

  public AttributeVector verify(Boolean verify) {
    return attr(CKA_VERIFY, verify);
  }

  public Boolean encrypt() {
    return getBooleanAttrValue(CKA_ENCRYPT);
  }

  public AttributeVector encrypt(Boolean encrypt) {
    return attr(CKA_ENCRYPT, encrypt);
  }

  public Boolean decrypt() {
    return getBooleanAttrValue(CKA_DECRYPT);
  }

  public AttributeVector decrypt(Boolean decrypt) {
    return attr(CKA_DECRYPT, decrypt);
  }

  public Boolean wrap() {
    return getBooleanAttrValue(CKA_WRAP);
  }

  public AttributeVector wrap(Boolean wrap) {
    return attr(CKA_WRAP, wrap);
  }

  public Boolean unwrap() {
    return getBooleanAttrValue(CKA_UNWRAP);
  }

  public AttributeVector unwrap(Boolean unwrap) {
    return attr(CKA_UNWRAP, unwrap);
  }

  public byte[] value() {
    return getByteArrayAttrValue(CKA_VALUE);
  }

  public AttributeVector value(byte[] value) {
    return attr(CKA_VALUE, value);
  }

  public Integer valueLen() {
    Long len = getLongAttrValue(CKA_VALUE_LEN);
    return len == null ? null : len.intValue();
  }

  public AttributeVector valueLen(int valueLen) {
    return attr(CKA_VALUE_LEN, (long) valueLen);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(200);
    sb.append("[");
    boolean first = true;
    for (Map.Entry<Long, Object> entry : attributes.entrySet()) {
      if (first) {
        first = false;
      } else {
        sb.append(", ");
      }

      long type = entry.getKey();
      Object value = entry.getValue();
      sb.append(ckaCodeToName(type)).append("=");
      if (sensitiveTypes.contains(type)) {
        sb.append("<sensitive>");
      } else if (value instanceof byte[]) {
        sb.append(Functions.toHex((byte[]) value));
      } else if (type == CKA_CLASS) {
        sb.append(codeToName(Category.CKO, (Long) value));
      } else if (type == CKA_KEY_TYPE) {
        sb.append(codeToName(Category.CKK, (Long) value));
      } else {
        sb.append(value);
      }
    }
    return sb.append("]").toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof AttributeVector)) {
      return false;
    }

    Map<Long, Object> otherAttrs = ((AttributeVector) obj).attributes;
    if (!attributes.keySet().equals(otherAttrs.keySet())) {
      return false;
    }

    for (Map.Entry<Long, Object> entry : attributes.entrySet()) {
      Object value = entry.getValue();
      Object otherValue = otherAttrs.get(entry.getKey());
      if (value instanceof byte[] && otherValue instanceof byte[]) {
        if (!Arrays.equals((byte[]) value, (byte[]) otherValue)) {
          return false;
        }
      } else if (value == null ? otherValue != null : !value.equals(otherValue)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return attributes.keySet().hashCode();
  }

}
