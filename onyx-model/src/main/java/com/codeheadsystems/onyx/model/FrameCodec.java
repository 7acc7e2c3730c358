package com.codeheadsystems.onyx.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between text lines and {@link Frame} variants.
 * <p>
 * Decoding never throws. Anything that is not a well-formed handshake or chat frame comes back as
 * an {@link UnknownFrame} carrying the reason, so one bad line cannot break processing of the next.
 */
@Singleton
public class FrameCodec {

  private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Frame codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public FrameCodec(final ObjectMapper objectMapper) {
    log.info("FrameCodec()");
    this.objectMapper = objectMapper;
  }

  /**
   * Serializes a frame to a single JSON line without the trailing newline.
   *
   * @param frame the frame
   * @return the json
   */
  public String encode(final Frame frame) {
    if (frame instanceof UnknownFrame) {
      throw new IllegalArgumentException("Unknown frames are never sent");
    }
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException e) {
      throw new FrameCodecException("Unable to serialize " + frame.type() + " frame", e);
    }
  }

  /**
   * Parses one received line.
   *
   * @param line the line
   * @return the frame; an {@link UnknownFrame} if the line is malformed
   */
  public Frame decode(final String line) {
    if (line == null || line.isBlank()) {
      return new UnknownFrame(null, "empty line");
    }
    final JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      return new UnknownFrame(null, "malformed JSON: " + e.getOriginalMessage());
    }
    if (node == null || !node.isObject()) {
      return new UnknownFrame(null, "not a JSON object");
    }
    final String type = node.path("type").textValue();
    if (HandshakeFrame.TYPE.equals(type)) {
      return decodeHandshake(node);
    } else if (ChatFrame.TYPE.equals(type)) {
      return decodeChat(node);
    }
    return new UnknownFrame(type, "unknown type");
  }

  private Frame decodeHandshake(final JsonNode node) {
    final HandshakeFrame frame;
    try {
      frame = objectMapper.treeToValue(node, HandshakeFrame.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      return new UnknownFrame(HandshakeFrame.TYPE, "unreadable handshake: " + e.getMessage());
    }
    if (isBlank(frame.senderId())) {
      return new UnknownFrame(HandshakeFrame.TYPE, "Missing required field: sender_id");
    }
    if (isBlank(frame.publicKeyPem())) {
      return new UnknownFrame(HandshakeFrame.TYPE, "Missing required field: pubkey");
    }
    return frame;
  }

  private Frame decodeChat(final JsonNode node) {
    final ChatFrame frame;
    try {
      frame = objectMapper.treeToValue(node, ChatFrame.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      return new UnknownFrame(ChatFrame.TYPE, "unreadable msg: " + e.getMessage());
    }
    if (isBlank(frame.senderId())) {
      return new UnknownFrame(ChatFrame.TYPE, "Missing required field: sender_id");
    }
    if (frame.payload() == null) {
      return new UnknownFrame(ChatFrame.TYPE, "Missing required field: payload");
    }
    try {
      frame.payload().envelope();
    } catch (IllegalArgumentException e) {
      return new UnknownFrame(ChatFrame.TYPE, e.getMessage());
    }
    return frame;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
