// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.xipki.p11webcrypto.WebCryptoException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON Web Key (RFC 7517) of a symmetric key: {"kty":"oct","k":..,"alg":..,"ext":..}.
 *
 * @author Lijun Liao (xipki)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"kty", "k", "alg", "ext"})
public class JsonWebKey {

  public static final String KTY_OCT = "oct";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private String kty;

  private String k;

  private String alg;

  private Boolean ext;

  public JsonWebKey() {
  }

  public JsonWebKey(String kty, String k, String alg, Boolean ext) {
    this.kty = kty;
    this.k = k;
    this.alg = alg;
    this.ext = ext;
  }

  public static JsonWebKey fromJson(byte[] json) throws WebCryptoException {
    try {
      return MAPPER.readValue(json, JsonWebKey.class);
    } catch (IOException ex) {
      throw new WebCryptoException("invalid JWK: " + ex.getMessage(), ex);
    }
  }

  public byte[] toJson() {
    try {
      return MAPPER.writeValueAsString(this).getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("could not serialize JWK", ex);
    }
  }

  public String getKty() {
    return kty;
  }

  public void setKty(String kty) {
    this.kty = kty;
  }

  /**
   * Returns the base64url encoded key value.
   *
   * @return the key value.
   */
  public String getK() {
    return k;
  }

  public void setK(String k) {
    this.k = k;
  }

  public String getAlg() {
    return alg;
  }

  public void setAlg(String alg) {
    this.alg = alg;
  }

  public Boolean getExt() {
    return ext;
  }

  public void setExt(Boolean ext) {
    this.ext = ext;
  }

  @Override
  public String toString() {
    // k is not printed
    return "JsonWebKey(kty=" + kty + ", alg=" + alg + ", ext=" + ext + ")";
  }

}
