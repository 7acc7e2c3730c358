package com.codeheadsystems.onyx.crypto;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeAuthenticationException;
import com.codeheadsystems.onyx.crypto.exceptions.KeyUnwrapException;
import com.codeheadsystems.onyx.crypto.exceptions.NoKeyForRecipientException;
import com.codeheadsystems.onyx.crypto.internal.OnyxCrypto;
import com.codeheadsystems.onyx.crypto.model.Envelope;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seals a plaintext once for any number of recipients and opens envelopes addressed to this identity.
 * <p>
 * <strong>Encrypt:</strong>
 * <ol>
 *   <li>Draw a fresh 256-bit AES key and a fresh 12-byte IV.</li>
 *   <li>AES-GCM seal the UTF-8 plaintext, then split the trailing 16-byte tag from the ciphertext.</li>
 *   <li>RSA-OAEP wrap the raw AES key under every recipient's public key.</li>
 * </ol>
 * <strong>Decrypt:</strong>
 * <ol>
 *   <li>Find this identity's wrapped key, or fail with {@link NoKeyForRecipientException}.</li>
 *   <li>Unwrap it with the private key, or fail with {@link KeyUnwrapException}.</li>
 *   <li>Rejoin {@code ciphertext || tag} and AES-GCM open it, or fail with
 *       {@link EnvelopeAuthenticationException}.</li>
 * </ol>
 */
@Singleton
public class EnvelopeEngine {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeEngine.class);

  private final OnyxCryptoConfig config;

  /**
   * Instantiates a new Envelope engine.
   *
   * @param config the crypto config
   */
  @Inject
  public EnvelopeEngine(final OnyxCryptoConfig config) {
    log.info("EnvelopeEngine({} bits)", config.rsaKeySize());
    this.config = config;
  }

  /**
   * Seals the plaintext for every peer currently in the directory.
   *
   * @param plaintext the plaintext
   * @param directory the peer directory; a snapshot is taken now
   * @return the envelope
   */
  public Envelope encrypt(final String plaintext, final PeerDirectory directory) {
    return encrypt(plaintext, directory.snapshot());
  }

  /**
   * Seals the plaintext for the given recipients. An empty recipient map still yields a valid
   * envelope that nobody can open.
   *
   * @param plaintext  the plaintext
   * @param recipients peer id to public key
   * @return the envelope
   */
  public Envelope encrypt(final String plaintext, final Map<String, PeerPublicKey> recipients) {
    final byte[] symmetricKey = config.randomProvider().randomBytes(OnyxCryptoConfig.SYMMETRIC_KEY_LENGTH);
    final byte[] iv = config.randomProvider().randomBytes(OnyxCryptoConfig.IV_LENGTH);
    final byte[] sealed = OnyxCrypto.aesGcmSeal(symmetricKey, iv, plaintext.getBytes(StandardCharsets.UTF_8));

    final Map<String, byte[]> wrappedKeys = new HashMap<>();
    for (Map.Entry<String, PeerPublicKey> recipient : recipients.entrySet()) {
      wrappedKeys.put(recipient.getKey(), OnyxCrypto.wrapKey(
          recipient.getValue().keyParameters(), symmetricKey, config.randomProvider().random()));
    }
    log.trace("encrypt(recipients={}, sealedBytes={})", wrappedKeys.size(), sealed.length);
    return Envelope.fromSealed(iv, sealed, wrappedKeys);
  }

  /**
   * Opens an envelope addressed to the given identity.
   *
   * @param envelope the envelope
   * @param identity this participant's identity
   * @return the plaintext
   * @throws NoKeyForRecipientException      if the envelope was not sealed for this identity
   * @throws KeyUnwrapException              if the wrapped key cannot be recovered
   * @throws EnvelopeAuthenticationException if the payload fails authentication
   */
  public String decrypt(final Envelope envelope, final Identity identity) {
    final byte[] wrappedKey = envelope.wrappedKeys().get(identity.id());
    if (wrappedKey == null) {
      throw new NoKeyForRecipientException("Envelope carries no key for " + identity.shortId());
    }
    final byte[] symmetricKey = OnyxCrypto.unwrapKey(identity.privateKey(), wrappedKey);
    if (symmetricKey.length != OnyxCryptoConfig.SYMMETRIC_KEY_LENGTH) {
      throw new KeyUnwrapException("Unwrapped key has " + symmetricKey.length + " bytes, expected "
          + OnyxCryptoConfig.SYMMETRIC_KEY_LENGTH);
    }
    if (envelope.iv().length != OnyxCryptoConfig.IV_LENGTH) {
      throw new EnvelopeAuthenticationException("IV has " + envelope.iv().length + " bytes");
    }
    if (envelope.tag().length != OnyxCryptoConfig.TAG_LENGTH) {
      throw new EnvelopeAuthenticationException("Tag has " + envelope.tag().length + " bytes");
    }
    final byte[] plaintext = OnyxCrypto.aesGcmOpen(symmetricKey, envelope.iv(), envelope.sealed());
    return new String(plaintext, StandardCharsets.UTF_8);
  }
}
