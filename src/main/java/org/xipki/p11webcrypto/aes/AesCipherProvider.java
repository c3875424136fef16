// Copyright (c) 2023 xipki. All rights reserved.
// License Apache License 2.0

package org.xipki.p11webcrypto.aes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xipki.p11webcrypto.KeyGenerationException;
import org.xipki.p11webcrypto.NotSupportedException;
import org.xipki.p11webcrypto.UnsupportedFormatException;
import org.xipki.p11webcrypto.WebCryptoException;
import org.xipki.p11webcrypto.wrapper.AttributeVector;
import org.xipki.p11webcrypto.wrapper.Functions;
import org.xipki.p11webcrypto.wrapper.Mechanism;
import org.xipki.p11webcrypto.wrapper.PKCS11Exception;
import org.xipki.p11webcrypto.wrapper.PKCS11Token;

import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;

import static org.xipki.p11webcrypto.wrapper.PKCS11Constants.*;

/**
 * WebCrypto AES (AES-GCM, AES-CBC and AES-ECB) on top of a {@link PKCS11Token}.
 * <p>
 * Every operation issues one working call to the token and either returns its result or throws.
 * Errors of the cipher calls are thrown as {@link PKCS11Exception} unchanged. The provider has no
 * mutable state and may be shared; whether calls against the same token run concurrently is up to
 * the token.
 *
 * <pre>
 * <code>
 *   AesCipherProvider provider = new AesCipherProvider(token, KeyTemplateConfig.fromSystem());
 *   CryptoKey key = provider.generateKey(new AesKeyAlgorithm(AesMode.GCM, 256), false,
 *       Arrays.asList("encrypt", "decrypt"));
 *   byte[] ciphertext = provider.encrypt(AesAlgorithm.gcm(iv), key, plaintext);
 * </code>
 * </pre>
 *
 * @author Lijun Liao (xipki)
 */
public class AesCipherProvider {

  public static final String FORMAT_JWK = "jwk";

  public static final String FORMAT_RAW = "raw";

  private static final Logger LOG = LoggerFactory.getLogger(AesCipherProvider.class);

  private final PKCS11Token token;

  private final KeyTemplateBuilder templateBuilder;

  private final KeyIdGenerator idGenerator;

  private final Executor executor;

  private final Map<AesMode, MechanismMapper> mappers;

  @FunctionalInterface
  private interface Operation<T> {
    T execute() throws WebCryptoException, PKCS11Exception;
  }

  public AesCipherProvider(PKCS11Token token, KeyTemplateConfig config) {
    this(token, config, new TokenKeyIdGenerator(token), ForkJoinPool.commonPool());
  }

  /**
   * Constructor.
   *
   * @param token       the token holding the keys and computing the ciphers.
   * @param config      settings of the created keys.
   * @param idGenerator generator of the CKA_ID of the created keys.
   * @param executor    executor of the asynchronous operations.
   */
  public AesCipherProvider(PKCS11Token token, KeyTemplateConfig config, KeyIdGenerator idGenerator,
                           Executor executor) {
    this.token = Functions.requireNonNull("token", token);
    this.templateBuilder = new KeyTemplateBuilder(config);
    this.idGenerator = Functions.requireNonNull("idGenerator", idGenerator);
    this.executor = Functions.requireNonNull("executor", executor);

    Map<AesMode, MechanismMapper> map = new EnumMap<>(AesMode.class);
    map.put(AesMode.GCM, new GcmMechanismMapper());
    map.put(AesMode.CBC, new CbcMechanismMapper());
    map.put(AesMode.ECB, new EcbMechanismMapper());
    this.mappers = Collections.unmodifiableMap(map);
  }

  public boolean isSupported(AesMode mode) {
    return mappers.containsKey(mode);
  }

  public CryptoKey generateKey(AesKeyAlgorithm algorithm, boolean extractable, Collection<String> usages)
      throws WebCryptoException, PKCS11Exception {
    getMapper(algorithm.getMode());
    int length = algorithm.getLength();
    if (length != 128 && length != 192 && length != 256) {
      throw new WebCryptoException("invalid AES key length " + length);
    }

    AttributeVector template = templateBuilder.build(idGenerator, algorithm, extractable, usages)
        .valueLen(length >> 3);

    long hKey;
    try {
      hKey = token.generateKey(new Mechanism(CKM_AES_KEY_GEN), template);
    } catch (PKCS11Exception ex) {
      LOG.warn("could not generate {} key: {}", algorithm, ex.getMessage());
      throw new KeyGenerationException("Aes: Can not generate new key\n" + ex.getMessage(), ex);
    }

    LOG.debug("generated {} key, handle={}", algorithm, hKey);
    return new CryptoKey(hKey, algorithm, extractable, usages);
  }

  /**
   * Exports the value of the key.
   *
   * @param format jwk (JSON encoded in UTF-8) or raw, case-insensitive.
   * @param key    the key.
   * @return the exported key.
   * @throws WebCryptoException if the format is unknown or the key is not extractable.
   * @throws PKCS11Exception    if the token refuses to return the key value.
   */
  public byte[] exportKey(String format, CryptoKey key) throws WebCryptoException, PKCS11Exception {
    switch (format.toLowerCase(Locale.ROOT)) {
      case FORMAT_JWK:
        return exportJwk(key).toJson();
      case FORMAT_RAW:
        return readKeyValue(key).value();
      default:
        throw new UnsupportedFormatException(format);
    }
  }

  public JsonWebKey exportJwk(CryptoKey key) throws WebCryptoException, PKCS11Exception {
    AttributeVector attrs = readKeyValue(key);
    String alg = "A" + (attrs.valueLen() * 8) + key.getAlgorithm().getMode().getJwkSuffix();
    String k = Base64.getUrlEncoder().withoutPadding().encodeToString(attrs.value());
    return new JsonWebKey(JsonWebKey.KTY_OCT, k, alg, key.isExtractable());
  }

  private AttributeVector readKeyValue(CryptoKey key) throws WebCryptoException, PKCS11Exception {
    if (!key.isExtractable()) {
      throw new WebCryptoException("key is not extractable");
    }
    return token.getAttrValues(key.getHandle(), CKA_VALUE, CKA_VALUE_LEN);
  }

  /**
   * Imports a key.
   *
   * @param format        jwk (JSON encoded in UTF-8) or raw, case-insensitive.
   * @param keyData       the encoded key.
   * @param algorithmName the algorithm name, e.g. AES-GCM.
   * @param extractable   whether the key value may be exported.
   * @param usages        the key usages.
   * @return the imported key.
   * @throws WebCryptoException if the format, the algorithm or the key data is invalid.
   * @throws PKCS11Exception    if the token refuses to create the key.
   */
  public CryptoKey importKey(String format, byte[] keyData, String algorithmName, boolean extractable,
                             Collection<String> usages) throws WebCryptoException, PKCS11Exception {
    switch (format.toLowerCase(Locale.ROOT)) {
      case FORMAT_JWK:
        return importJwk(JsonWebKey.fromJson(keyData), algorithmName, extractable, usages);
      case FORMAT_RAW:
        return importRawKey(keyData.clone(), algorithmName, extractable, usages);
      default:
        throw new UnsupportedFormatException(format);
    }
  }

  public CryptoKey importJwk(JsonWebKey jwk, String algorithmName, boolean extractable,
                             Collection<String> usages) throws WebCryptoException, PKCS11Exception {
    if (jwk.getKty() != null && !JsonWebKey.KTY_OCT.equals(jwk.getKty())) {
      throw new WebCryptoException("JWK kty must be '" + JsonWebKey.KTY_OCT + "', but is '" + jwk.getKty() + "'");
    }

    if (jwk.getK() == null) {
      throw new WebCryptoException("JWK has no 'k'");
    }

    byte[] value;
    try {
      value = Base64.getUrlDecoder().decode(jwk.getK());
    } catch (IllegalArgumentException ex) {
      throw new WebCryptoException("JWK 'k' is not base64url encoded", ex);
    }
    return importRawKey(value, algorithmName, extractable, usages);
  }

  private CryptoKey importRawKey(byte[] value, String algorithmName, boolean extractable,
                                 Collection<String> usages) throws WebCryptoException, PKCS11Exception {
    AesMode mode = AesMode.forAlgorithmName(algorithmName);
    getMapper(mode);

    AesKeyAlgorithm algorithm = new AesKeyAlgorithm(mode, value.length * 8);
    AttributeVector template = templateBuilder.build(idGenerator, algorithm, extractable, usages)
        .value(value).attributesAsSensitive(CKA_VALUE);

    long hKey = token.createObject(template);
    LOG.debug("imported {} key, handle={}", algorithm, hKey);
    return new CryptoKey(hKey, algorithm, extractable, usages);
  }

  public byte[] encrypt(AesAlgorithm algorithm, CryptoKey key, byte[] data)
      throws WebCryptoException, PKCS11Exception {
    MechanismMapper mapper = getMapper(algorithm.getMode());
    assertKeyMatches(algorithm, key);

    if (algorithm.getMode().isPadding()) {
      data = AesPadding.pad(data);
    }

    Mechanism mechanism = mapper.toMechanism(algorithm, token.getCryptokiVersion());
    byte[] out = new byte[AesPadding.getOutputBufferSize(key.getAlgorithm().getLength(), true, data.length)];
    int outLen = token.encrypt(mechanism, key.getHandle(), data, out);
    return (outLen == out.length) ? out : Arrays.copyOf(out, outLen);
  }

  public byte[] decrypt(AesAlgorithm algorithm, CryptoKey key, byte[] data)
      throws WebCryptoException, PKCS11Exception {
    MechanismMapper mapper = getMapper(algorithm.getMode());
    assertKeyMatches(algorithm, key);

    Mechanism mechanism = mapper.toMechanism(algorithm, token.getCryptokiVersion());
    byte[] out = new byte[AesPadding.getOutputBufferSize(key.getAlgorithm().getLength(), false, data.length)];
    int outLen = token.decrypt(mechanism, key.getHandle(), data, out);
    byte[] decrypted = (outLen == out.length) ? out : Arrays.copyOf(out, outLen);
    return algorithm.getMode().isPadding() ? AesPadding.unpad(decrypted) : decrypted;
  }

  public CompletableFuture<CryptoKey> generateKeyAsync(AesKeyAlgorithm algorithm, boolean extractable,
                                                       Collection<String> usages) {
    return submit(() -> generateKey(algorithm, extractable, usages));
  }

  public CompletableFuture<byte[]> exportKeyAsync(String format, CryptoKey key) {
    return submit(() -> exportKey(format, key));
  }

  public CompletableFuture<CryptoKey> importKeyAsync(String format, byte[] keyData, String algorithmName,
                                                     boolean extractable, Collection<String> usages) {
    return submit(() -> importKey(format, keyData, algorithmName, extractable, usages));
  }

  public CompletableFuture<byte[]> encryptAsync(AesAlgorithm algorithm, CryptoKey key, byte[] data) {
    return submit(() -> encrypt(algorithm, key, data));
  }

  public CompletableFuture<byte[]> decryptAsync(AesAlgorithm algorithm, CryptoKey key, byte[] data) {
    return submit(() -> decrypt(algorithm, key, data));
  }

  private <T> CompletableFuture<T> submit(Operation<T> operation) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      executor.execute(() -> {
        try {
          future.complete(operation.execute());
        } catch (Throwable th) {
          future.completeExceptionally(th);
        }
      });
    } catch (RejectedExecutionException ex) {
      LOG.warn("could not submit the operation: {}", ex.getMessage());
      future.completeExceptionally(ex);
    }
    return future;
  }

  private MechanismMapper getMapper(AesMode mode) throws NotSupportedException {
    if (!isSupported(mode)) {
      throw new NotSupportedException(mode.getAlgorithmName() + " is not supported");
    }
    return mappers.get(mode);
  }

  private static void assertKeyMatches(AesAlgorithm algorithm, CryptoKey key) throws WebCryptoException {
    AesMode keyMode = key.getAlgorithm().getMode();
    if (keyMode != algorithm.getMode()) {
      throw new WebCryptoException("key algorithm " + keyMode.getAlgorithmName()
          + " does not match " + algorithm.getName());
    }
  }

}
