package com.codeheadsystems.onyx.crypto;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.KeyGenerationException;
import com.codeheadsystems.onyx.crypto.internal.OnyxCrypto;
import com.codeheadsystems.onyx.crypto.internal.PemCodec;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import java.io.IOException;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This participant's session identity: a random UUID-shaped id and an RSA key pair.
 * <p>
 * Created once per process and immutable afterwards. The private half is only reachable from this
 * package, where the {@link EnvelopeEngine} uses it to unwrap envelope keys; nothing is persisted.
 */
public final class Identity {

  private static final Logger log = LoggerFactory.getLogger(Identity.class);

  private static final int SHORT_ID_LENGTH = 8;

  private final String id;
  private final RSAKeyParameters publicKey;
  private final RSAKeyParameters privateKey;
  private final String publicKeyPem;

  private Identity(String id, RSAKeyParameters publicKey, RSAKeyParameters privateKey, String publicKeyPem) {
    this.id = id;
    this.publicKey = publicKey;
    this.privateKey = privateKey;
    this.publicKeyPem = publicKeyPem;
  }

  /**
   * Generates a new identity. Two calls yield two unrelated identities; call exactly once per session.
   *
   * @param config the crypto config
   * @return the identity
   * @throws KeyGenerationException if key generation or PEM export fails
   */
  public static Identity generate(OnyxCryptoConfig config) {
    final String id = config.randomProvider().randomUuid();
    log.info("generate(id={}, bits={})", id, config.rsaKeySize());
    try {
      AsymmetricCipherKeyPair keyPair = OnyxCrypto.generateRsaKeyPair(
          config.rsaKeySize(), config.randomProvider().random());
      RSAKeyParameters publicKey = (RSAKeyParameters) keyPair.getPublic();
      RSAKeyParameters privateKey = (RSAKeyParameters) keyPair.getPrivate();
      return new Identity(id, publicKey, privateKey, PemCodec.encode(publicKey));
    } catch (IOException e) {
      throw new KeyGenerationException("Unable to export public key for " + id, e);
    } catch (RuntimeException e) {
      throw new KeyGenerationException("RSA key generation failed for " + id, e);
    }
  }

  /**
   * The session identifier.
   *
   * @return the string
   */
  public String id() {
    return id;
  }

  /**
   * First eight characters of the id, for display.
   *
   * @return the string
   */
  public String shortId() {
    return shortId(id);
  }

  /**
   * The public key as PEM-encoded SPKI, ready for a handshake frame.
   *
   * @return the string
   */
  public String publicKeyPem() {
    return publicKeyPem;
  }

  /**
   * This identity's own public key in peer form.
   *
   * @return the peer public key
   */
  public PeerPublicKey publicKey() {
    return new PeerPublicKey(publicKey, publicKeyPem);
  }

  RSAKeyParameters privateKey() {
    return privateKey;
  }

  /**
   * Truncates any peer id for display.
   *
   * @param peerId the peer id
   * @return the string
   */
  public static String shortId(String peerId) {
    if (peerId == null) {
      return "unknown";
    }
    return peerId.length() <= SHORT_ID_LENGTH ? peerId : peerId.substring(0, SHORT_ID_LENGTH);
  }

  @Override
  public String toString() {
    return "Identity{id=" + id + "}";
  }
}
