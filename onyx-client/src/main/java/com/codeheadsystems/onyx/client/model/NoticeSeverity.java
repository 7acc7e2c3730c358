package com.codeheadsystems.onyx.client.model;

/**
 * How prominently the host should render a system notice.
 */
public enum NoticeSeverity {
  /**
   * Lifecycle information: connected, new peer.
   */
  INFO,
  /**
   * Expected and harmless, e.g. overhearing a message addressed to other peers.
   */
  MUTED,
  /**
   * The session continues but the operator should know, e.g. sending with no peers.
   */
  WARNING,
  /**
   * One operation failed: a rejected key, an unreadable message, a failed send.
   */
  ERROR
}
