package com.codeheadsystems.onyx.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Encrypted chat message: { type: "msg", sender_id, payload }.
 *
 * @param senderId the sender's session id
 * @param payload  the base64-encoded envelope
 */
@JsonIgnoreProperties(value = {"type"}, allowGetters = true, ignoreUnknown = true)
@JsonPropertyOrder({"type", "sender_id", "payload"})
public record ChatFrame(@JsonProperty("sender_id") String senderId,
                        @JsonProperty("payload") EnvelopePayload payload) implements Frame {

  /**
   * Wire discriminator.
   */
  public static final String TYPE = "msg";

  @Override
  @JsonProperty("type")
  public String type() {
    return TYPE;
  }
}
