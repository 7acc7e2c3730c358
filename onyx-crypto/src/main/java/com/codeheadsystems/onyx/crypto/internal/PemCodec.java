package com.codeheadsystems.onyx.crypto.internal;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.KeyImportException;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.PublicKeyFactory;
import org.bouncycastle.crypto.util.SubjectPublicKeyInfoFactory;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * SPKI public keys to and from PEM ({@code -----BEGIN PUBLIC KEY-----}, 64-character lines,
 * {@code \n} line endings with a trailing newline).
 */
public class PemCodec {

  /**
   * PEM label for SubjectPublicKeyInfo.
   */
  public static final String PUBLIC_KEY_TYPE = "PUBLIC KEY";

  private PemCodec() {
  }

  /**
   * Encodes a public key as SPKI DER wrapped in PEM.
   *
   * @param publicKey the public key
   * @return the PEM string
   * @throws IOException if the key cannot be DER encoded
   */
  public static String encode(AsymmetricKeyParameter publicKey) throws IOException {
    byte[] spki = SubjectPublicKeyInfoFactory.createSubjectPublicKeyInfo(publicKey).getEncoded();
    StringWriter out = new StringWriter();
    try (PemWriter writer = new PemWriter(out)) {
      writer.writeObject(new PemObject(PUBLIC_KEY_TYPE, spki));
    }
    return out.toString().replace("\r\n", "\n");
  }

  /**
   * Parses a PEM SPKI block into an encrypt-only RSA key.
   *
   * @param pem the PEM string
   * @return the peer public key
   * @throws KeyImportException if the PEM is absent or malformed, not an RSA public key, or the
   *                            modulus is below {@link OnyxCryptoConfig#MIN_RSA_KEY_SIZE}
   */
  public static PeerPublicKey decode(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new KeyImportException("Missing PEM public key");
    }
    PemObject pemObject;
    try (PemReader reader = new PemReader(new StringReader(pem))) {
      pemObject = reader.readPemObject();
    } catch (IOException | RuntimeException e) {
      throw new KeyImportException("Malformed PEM public key", e);
    }
    if (pemObject == null) {
      throw new KeyImportException("No PEM block found");
    }
    if (!PUBLIC_KEY_TYPE.equals(pemObject.getType())) {
      throw new KeyImportException("Unexpected PEM type: " + pemObject.getType());
    }
    AsymmetricKeyParameter key;
    try {
      key = PublicKeyFactory.createKey(pemObject.getContent());
    } catch (IOException | RuntimeException e) {
      throw new KeyImportException("Invalid SPKI structure", e);
    }
    if (!(key instanceof RSAKeyParameters rsa) || rsa.isPrivate()) {
      throw new KeyImportException("Not an RSA public key: " + key.getClass().getSimpleName());
    }
    if (rsa.getModulus().bitLength() < OnyxCryptoConfig.MIN_RSA_KEY_SIZE) {
      throw new KeyImportException("RSA key too small: " + rsa.getModulus().bitLength() + " bits");
    }
    return new PeerPublicKey(rsa, pem);
  }
}
