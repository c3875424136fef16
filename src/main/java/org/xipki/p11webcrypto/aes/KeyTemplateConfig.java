// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import java.util.Map;
import java.util.Properties;

/**
 * Process-wide settings for the keys created by this library. Fixed once constructed.
 *
 * @author Lijun Liao (xipki)
 */
public class KeyTemplateConfig {

  public static final String PROP_TOKEN = "org.xipki.p11webcrypto.token";

  public static final String PROP_SENSITIVE = "org.xipki.p11webcrypto.sensitive";

  public static final String ENV_TOKEN = "WEBCRYPTO_PKCS11_TOKEN";

  public static final String ENV_SENSITIVE = "WEBCRYPTO_PKCS11_SENSITIVE";

  public static final KeyTemplateConfig DEFAULT = new KeyTemplateConfig(false, false);

  private final boolean token;

  private final boolean sensitive;

  /**
   * Constructor.
   *
   * @param token     whether generated and imported keys are token objects (persistent).
   * @param sensitive whether generated and imported keys are sensitive, i.e. their value can not be
   *                  read from the token regardless of the extractable flag.
   */
  public KeyTemplateConfig(boolean token, boolean sensitive) {
    this.token = token;
    this.sensitive = sensitive;
  }

  /**
   * Reads the settings from the system properties {@value #PROP_TOKEN} and {@value #PROP_SENSITIVE},
   * falling back to the environment variables {@value #ENV_TOKEN} and {@value #ENV_SENSITIVE}.
   *
   * @return the configuration.
   */
  public static KeyTemplateConfig fromSystem() {
    return from(System.getProperties(), System.getenv());
  }

  public static KeyTemplateConfig fromEnvironment(Map<String, String> env) {
    return from(new Properties(), env);
  }

  /**
   * Reads the settings from the given properties, falling back to the given environment for every
   * property that is absent or empty.
   *
   * @param props the properties.
   * @param env   the environment variables.
   * @return the configuration.
   */
  public static KeyTemplateConfig from(Properties props, Map<String, String> env) {
    return new KeyTemplateConfig(
        isSet(props.getProperty(PROP_TOKEN), env.get(ENV_TOKEN)),
        isSet(props.getProperty(PROP_SENSITIVE), env.get(ENV_SENSITIVE)));
  }

  // any non-empty value enables the flag
  private static boolean isSet(String property, String env) {
    return isNotEmpty(property) || isNotEmpty(env);
  }

  private static boolean isNotEmpty(String value) {
    return value != null && !value.isEmpty();
  }

  public boolean isToken() {
    return token;
  }

  public boolean isSensitive() {
    return sensitive;
  }

  @Override
  public String toString() {
    return "KeyTemplateConfig(token=" + token + ", sensitive=" + sensitive + ")";
  }

}
