package com.codeheadsystems.onyx.model;

/**
 * One newline-delimited JSON record exchanged through the relay, discriminated by {@code type}.
 * Parsed once at the transport boundary by {@link FrameCodec}.
 */
public sealed interface Frame permits HandshakeFrame, ChatFrame, UnknownFrame {

  /**
   * The wire {@code type} discriminator.
   *
   * @return the type, possibly null for unparseable input
   */
  String type();
}
