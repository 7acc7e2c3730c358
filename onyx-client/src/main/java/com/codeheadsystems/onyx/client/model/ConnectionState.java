package com.codeheadsystems.onyx.client.model;

/**
 * Relay connection state reported to the host.
 */
public enum ConnectionState {
  CONNECTING,
  CONNECTED,
  DISCONNECTED,
  FAILED
}
