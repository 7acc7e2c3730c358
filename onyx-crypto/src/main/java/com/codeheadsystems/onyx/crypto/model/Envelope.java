package com.codeheadsystems.onyx.crypto.model;

import com.codeheadsystems.onyx.crypto.common.ByteUtils;
import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid-encryption envelope: { iv, tag, ciphertext, wrappedKeys }.
 * <p>
 * The payload is sealed once with a one-time AES-256-GCM key; that key is wrapped separately under
 * each recipient's RSA-OAEP public key. AES-GCM emits {@code ciphertext || tag}; on the wire the two
 * are independent fields, split at {@link OnyxCryptoConfig#TAG_LENGTH} bytes from the end.
 *
 * @param iv          12-byte GCM nonce, fresh per envelope
 * @param tag         16-byte GCM authentication tag
 * @param ciphertext  ciphertext without the tag
 * @param wrappedKeys peer id to that peer's RSA-OAEP wrapped copy of the symmetric key
 */
public record Envelope(byte[] iv, byte[] tag, byte[] ciphertext, Map<String, byte[]> wrappedKeys) {

  /**
   * Instantiates a new Envelope. The wrapped key map is copied.
   */
  public Envelope {
    if (iv == null || tag == null || ciphertext == null || wrappedKeys == null) {
      throw new IllegalArgumentException("Envelope fields must not be null");
    }
    wrappedKeys = Map.copyOf(wrappedKeys);
  }

  /**
   * Builds an envelope from combined AES-GCM output, splitting off the trailing tag.
   *
   * @param iv          the iv
   * @param sealed      ciphertext followed by the 16-byte tag
   * @param wrappedKeys the wrapped keys
   * @return the envelope
   */
  public static Envelope fromSealed(byte[] iv, byte[] sealed, Map<String, byte[]> wrappedKeys) {
    int ciphertextLength = sealed.length - OnyxCryptoConfig.TAG_LENGTH;
    if (ciphertextLength < 0) {
      throw new IllegalArgumentException("Sealed output shorter than the authentication tag: " + sealed.length);
    }
    return new Envelope(iv,
        ByteUtils.tail(sealed, OnyxCryptoConfig.TAG_LENGTH),
        ByteUtils.head(sealed, ciphertextLength),
        wrappedKeys);
  }

  /**
   * Reassembles {@code ciphertext || tag} for AES-GCM decryption.
   *
   * @return the byte [ ]
   */
  public byte[] sealed() {
    return ByteUtils.concat(ciphertext, tag);
  }

  /**
   * Whether this envelope carries a wrapped key for the given peer id.
   *
   * @param peerId the peer id
   * @return true if addressed to the peer
   */
  public boolean isAddressedTo(String peerId) {
    return wrappedKeys.containsKey(peerId);
  }

  /**
   * The ids this envelope was sealed for.
   *
   * @return the set
   */
  public Set<String> recipients() {
    return wrappedKeys.keySet();
  }
}
