package com.codeheadsystems.onyx.crypto.internal;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeAuthenticationException;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeEncryptionException;
import com.codeheadsystems.onyx.crypto.exceptions.KeyUnwrapException;
import java.math.BigInteger;
import java.security.SecureRandom;
import org.bouncycastle.crypto.AsymmetricBlockCipher;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.encodings.OAEPEncoding;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.engines.RSABlindedEngine;
import org.bouncycastle.crypto.generators.RSAKeyPairGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.crypto.params.RSAKeyGenerationParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;

/**
 * Low-level cryptographic primitives for the envelope protocol.
 * Wraps BouncyCastle RSA key generation, RSA-OAEP (SHA-256 / MGF1-SHA-256, empty label) and
 * AES-256-GCM with a 128-bit tag and no associated data.
 */
public class OnyxCrypto {

  private static final int TAG_BITS = OnyxCryptoConfig.TAG_LENGTH * 8;

  private OnyxCrypto() {
  }

  /**
   * Generates an RSA key pair with public exponent 65537.
   */
  public static AsymmetricCipherKeyPair generateRsaKeyPair(int bits, SecureRandom random) {
    RSAKeyPairGenerator generator = new RSAKeyPairGenerator();
    generator.init(new RSAKeyGenerationParameters(
        BigInteger.valueOf(OnyxCryptoConfig.RSA_PUBLIC_EXPONENT), random, bits, OnyxCryptoConfig.RSA_PRIME_CERTAINTY));
    return generator.generateKeyPair();
  }

  /**
   * RSA-OAEP encrypts the raw symmetric key under a recipient's public key.
   */
  public static byte[] wrapKey(RSAKeyParameters publicKey, byte[] symmetricKey, SecureRandom random) {
    AsymmetricBlockCipher oaep = oaep();
    oaep.init(true, new ParametersWithRandom(publicKey, random));
    try {
      return oaep.processBlock(symmetricKey, 0, symmetricKey.length);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new EnvelopeEncryptionException("RSA-OAEP key wrap failed", e);
    }
  }

  /**
   * RSA-OAEP decrypts a wrapped symmetric key with this participant's private key.
   */
  public static byte[] unwrapKey(RSAKeyParameters privateKey, byte[] wrappedKey) {
    AsymmetricBlockCipher oaep = oaep();
    oaep.init(false, privateKey);
    try {
      return oaep.processBlock(wrappedKey, 0, wrappedKey.length);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new KeyUnwrapException("RSA-OAEP key unwrap failed", e);
    }
  }

  /**
   * AES-GCM encrypts the plaintext. Returns {@code ciphertext || tag}.
   */
  public static byte[] aesGcmSeal(byte[] key, byte[] iv, byte[] plaintext) {
    GCMModeCipher gcm = gcm(true, key, iv);
    byte[] out = new byte[gcm.getOutputSize(plaintext.length)];
    try {
      int len = gcm.processBytes(plaintext, 0, plaintext.length, out, 0);
      gcm.doFinal(out, len);
    } catch (InvalidCipherTextException | DataLengthException | IllegalStateException e) {
      throw new EnvelopeEncryptionException("AES-GCM encryption failed", e);
    }
    return out;
  }

  /**
   * AES-GCM decrypts and verifies {@code ciphertext || tag}.
   */
  public static byte[] aesGcmOpen(byte[] key, byte[] iv, byte[] sealed) {
    GCMModeCipher gcm = gcm(false, key, iv);
    byte[] out = new byte[gcm.getOutputSize(sealed.length)];
    try {
      int len = gcm.processBytes(sealed, 0, sealed.length, out, 0);
      len += gcm.doFinal(out, len);
      if (len == out.length) {
        return out;
      }
      byte[] trimmed = new byte[len];
      System.arraycopy(out, 0, trimmed, 0, len);
      return trimmed;
    } catch (InvalidCipherTextException | DataLengthException | IllegalStateException e) {
      throw new EnvelopeAuthenticationException("AES-GCM authentication failed", e);
    }
  }

  private static AsymmetricBlockCipher oaep() {
    return new OAEPEncoding(new RSABlindedEngine(), new SHA256Digest(), new SHA256Digest(), null);
  }

  private static GCMModeCipher gcm(boolean forEncryption, byte[] key, byte[] iv) {
    GCMModeCipher gcm = GCMBlockCipher.newInstance(AESEngine.newInstance());
    gcm.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_BITS, iv));
    return gcm;
  }
}
