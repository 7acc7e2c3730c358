package com.codeheadsystems.onyx.client.model;

/**
 * What processing one inbound handshake did.
 */
public enum HandshakeOutcome {
  /**
   * Our own announcement echoed back by the relay; ignored.
   */
  SELF_ECHO,
  /**
   * The sender is already in the directory; ignored without a reply.
   */
  ALREADY_KNOWN,
  /**
   * The sender's key was imported and a reply announcement was sent.
   */
  NEW_PEER,
  /**
   * The sender's key could not be imported; the peer was not added.
   */
  IMPORT_FAILED
}
