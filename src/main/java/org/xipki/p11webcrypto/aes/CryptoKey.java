// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.xipki.p11webcrypto.wrapper.Functions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Reference to an AES secret key object living in a token, together with the algorithm it was
 * generated or imported for. The key object itself is owned by the token.
 *
 * @author Lijun Liao (xipki)
 */
public class CryptoKey {

  private final long handle;

  private final AesKeyAlgorithm algorithm;

  private final boolean extractable;

  private final List<String> usages;

  public CryptoKey(long handle, AesKeyAlgorithm algorithm, boolean extractable, Collection<String> usages) {
    this.handle = handle;
    this.algorithm = Functions.requireNonNull("algorithm", algorithm);
    this.extractable = extractable;
    this.usages = Collections.unmodifiableList(new ArrayList<>(Functions.requireNonNull("usages", usages)));
  }

  /**
   * Returns the handle of the key object in the token.
   *
   * @return the object handle.
   */
  public long getHandle() {
    return handle;
  }

  public AesKeyAlgorithm getAlgorithm() {
    return algorithm;
  }

  public boolean isExtractable() {
    return extractable;
  }

  public List<String> getUsages() {
    return usages;
  }

  @Override
  public String toString() {
    return "CryptoKey(handle=" + handle + ", algorithm=" + algorithm
        + ", extractable=" + extractable + ", usages=" + usages + ")";
  }

}
