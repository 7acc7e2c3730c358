package com.codeheadsystems.onyx.crypto.config;

import com.codeheadsystems.onyx.crypto.common.RandomProvider;

/**
 * Configuration for identity generation and envelope encryption.
 * Holds the RSA modulus size, the random source, and the fixed wire-format constants.
 *
 * @param rsaKeySize     RSA modulus length in bits
 * @param randomProvider source of keys, IVs and session identifiers
 */
public record OnyxCryptoConfig(int rsaKeySize, RandomProvider randomProvider) {

  /**
   * AES-256 key length in bytes.
   */
  public static final int SYMMETRIC_KEY_LENGTH = 32;
  /**
   * AES-GCM IV length in bytes.
   */
  public static final int IV_LENGTH = 12;
  /**
   * AES-GCM authentication tag length in bytes. The tag travels as its own wire field.
   */
  public static final int TAG_LENGTH = 16;
  /**
   * RSA public exponent (F4).
   */
  public static final long RSA_PUBLIC_EXPONENT = 65537L;
  /**
   * Miller-Rabin certainty used during prime generation.
   */
  public static final int RSA_PRIME_CERTAINTY = 112;
  /**
   * Smallest RSA modulus, in bits, accepted for our own keys and for imported peer keys.
   */
  public static final int MIN_RSA_KEY_SIZE = 2048;

  /**
   * RSA-2048 with a default {@link RandomProvider}.
   */
  public static final OnyxCryptoConfig DEFAULT = new OnyxCryptoConfig(MIN_RSA_KEY_SIZE, new RandomProvider());

  /**
   * Validates the modulus size.
   */
  public OnyxCryptoConfig {
    if (rsaKeySize < MIN_RSA_KEY_SIZE) {
      throw new IllegalArgumentException("RSA key size must be at least 2048 bits: " + rsaKeySize);
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the onyx crypto config
   */
  public OnyxCryptoConfig withRandomProvider(RandomProvider randomProvider) {
    return new OnyxCryptoConfig(rsaKeySize, randomProvider);
  }
}
