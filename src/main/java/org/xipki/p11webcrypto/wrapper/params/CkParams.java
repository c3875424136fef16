// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper.params;

import org.xipki.p11webcrypto.wrapper.Functions;

/**
 * Every Parameters-class extends this class. The parameters are the payload of a
 * {@link org.xipki.p11webcrypto.wrapper.Mechanism} and are interpreted only by the token.
 *
 * @author Lijun Liao (xipki)
 */
public abstract class CkParams {

  /**
   * Get the name of the corresponding CK_*_PARAMS structure.
   *
   * @return the structure name.
   */
  public abstract String getStructName();

  protected abstract int getMaxFieldLen();

  public abstract String toString(String indent);

  @Override
  public String toString() {
    return toString("");
  }

  protected String ptr2str(String indent, String name, byte[] value) {
    return "\n" + indent + "  " + formatFieldName(name) + Functions.toString("", value);
  }

  protected String val2Str(String indent, String name, Object value) {
    return "\n" + indent + "  " + formatFieldName(name) + value;
  }

  private String formatFieldName(String name) {
    StringBuilder sb = new StringBuilder(name).append(": ");
    for (int i = name.length(); i < getMaxFieldLen(); i++) {
      sb.append(' ');
    }
    return sb.toString();
  }

  protected static <T> T requireNonNull(String paramName, T param) {
    return Functions.requireNonNull(paramName, param);
  }

}
