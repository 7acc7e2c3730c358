package com.codeheadsystems.onyx.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Key announcement: { type: "handshake", sender_id, pubkey }.
 * <p>
 * Sent unsolicited when a client connects, and once in reply to every first-seen peer so that
 * whichever side joined later still learns the earlier side's key.
 *
 * @param senderId     the announcing participant's session id
 * @param publicKeyPem the announcing participant's SPKI public key in PEM form
 */
@JsonIgnoreProperties(value = {"type"}, allowGetters = true, ignoreUnknown = true)
@JsonPropertyOrder({"type", "sender_id", "pubkey"})
public record HandshakeFrame(@JsonProperty("sender_id") String senderId,
                             @JsonProperty("pubkey") String publicKeyPem) implements Frame {

  /**
   * Wire discriminator.
   */
  public static final String TYPE = "handshake";

  @Override
  @JsonProperty("type")
  public String type() {
    return TYPE;
  }
}
