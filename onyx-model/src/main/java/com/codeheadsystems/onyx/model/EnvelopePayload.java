package com.codeheadsystems.onyx.model;

import com.codeheadsystems.onyx.crypto.model.Envelope;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Wire model for an {@link Envelope}: every binary field is standard, padded base64.
 * <p>
 * {@code tag} and {@code ciphertext} are separate fields; the ciphertext does not carry the tag.
 * {@code keys} maps each recipient id to its RSA-OAEP wrapped copy of the message key. A missing
 * {@code keys} object is read as an envelope addressed to nobody.
 *
 * @param ivBase64         base64-encoded 12-byte GCM IV
 * @param tagBase64        base64-encoded 16-byte GCM tag
 * @param ciphertextBase64 base64-encoded ciphertext (empty for an empty plaintext)
 * @param wrappedKeys      recipient id to base64-encoded wrapped key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"iv", "tag", "ciphertext", "keys"})
public record EnvelopePayload(@JsonProperty("iv") String ivBase64,
                              @JsonProperty("tag") String tagBase64,
                              @JsonProperty("ciphertext") String ciphertextBase64,
                              @JsonProperty("keys") Map<String, String> wrappedKeys) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Encodes a domain envelope.
   *
   * @param envelope the envelope
   */
  public EnvelopePayload(Envelope envelope) {
    this(B64.encodeToString(envelope.iv()),
        B64.encodeToString(envelope.tag()),
        B64.encodeToString(envelope.ciphertext()),
        encodeKeys(envelope.wrappedKeys()));
  }

  private static Map<String, String> encodeKeys(Map<String, byte[]> wrappedKeys) {
    Map<String, String> encoded = new HashMap<>();
    wrappedKeys.forEach((peerId, key) -> encoded.put(peerId, B64.encodeToString(key)));
    return encoded;
  }

  private static byte[] decode(String value, String fieldName, boolean allowEmpty) {
    if (value == null || (!allowEmpty && value.isBlank())) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  /**
   * Decodes to the domain envelope.
   *
   * @return the envelope
   * @throws IllegalArgumentException naming the missing or malformed field
   */
  public Envelope envelope() {
    Map<String, byte[]> keys = new HashMap<>();
    if (wrappedKeys != null) {
      wrappedKeys.forEach((peerId, key) -> keys.put(peerId, decode(key, "keys." + peerId, false)));
    }
    return new Envelope(
        decode(ivBase64, "iv", false),
        decode(tagBase64, "tag", false),
        decode(ciphertextBase64, "ciphertext", true),
        keys);
  }
}
