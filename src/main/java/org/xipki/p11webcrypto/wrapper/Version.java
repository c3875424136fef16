// Copyright (c) 2002 Graz University of Technology. All rights reserved.
// License IAIK PKCS#11 Wrapper License.
//
// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

/**
 * Objects of this class represent a version. This consists of a major and a
 * minor version number, as the CK_VERSION structure of PKCS#11 does.
 *
 * @author Karl Scheibelhofer (SIC)
 * @author Lijun Liao (xipki)
 */
public class Version {

  public static final Version V2_20 = new Version((byte) 2, (byte) 20);

  public static final Version V2_40 = new Version((byte) 2, (byte) 40);

  public static final Version V3_0 = new Version((byte) 3, (byte) 0);

  /**
   * The major version number.
   */
  private final byte major;

  /**
   * The minor version number.
   */
  private final byte minor;

  public Version(byte major, byte minor) {
    this.major = major;
    this.minor = minor;
  }

  public boolean isAtLeast(int major, int minor) {
    return toInt() >= (((0xFF & major) << 8) + (0xFF & minor));
  }

  private int toInt() {
    return ((0xFF & major) << 8) + (0xFF & minor);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Version)) {
      return false;
    }

    Version other = (Version) obj;
    return major == other.major && minor == other.minor;
  }

  @Override
  public int hashCode() {
    return toInt();
  }

  /**
   * Returns the string representation of this object.
   *
   * @return the string representation of this object
   */
  @Override
  public String toString() {
    return (0xFF & major) + "." + (0xFF & minor);
  }

}
