// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.wrapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger shared by the wrapper classes.
 *
 * @author Lijun Liao (xipki)
 */
public class StaticLogger {

  private static final Logger LOG = LoggerFactory.getLogger("org.xipki.p11webcrypto");

  private StaticLogger() {
  }

  public static boolean isDebugEnabled() {
    return LOG.isDebugEnabled();
  }

  public static void debug(String format, Object... arguments) {
    LOG.debug(format, arguments);
  }

}
