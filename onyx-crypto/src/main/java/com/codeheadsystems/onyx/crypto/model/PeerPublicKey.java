package com.codeheadsystems.onyx.crypto.model;

import org.bouncycastle.crypto.params.RSAKeyParameters;

/**
 * A peer's imported RSA public key. Only usable for wrapping symmetric keys; it never carries
 * private material.
 *
 * @param keyParameters the RSA modulus and public exponent
 * @param pem           the PEM the key was imported from
 */
public record PeerPublicKey(RSAKeyParameters keyParameters, String pem) {

  /**
   * Rejects private key material.
   */
  public PeerPublicKey {
    if (keyParameters == null || keyParameters.isPrivate()) {
      throw new IllegalArgumentException("A peer key must be an RSA public key");
    }
  }

  /**
   * RSA modulus length in bits.
   *
   * @return the int
   */
  public int bitLength() {
    return keyParameters.getModulus().bitLength();
  }
}
