package com.codeheadsystems.onyx.client;

import com.codeheadsystems.onyx.client.model.ConnectionState;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;

/**
 * Hooks the host (console, UI) implements to render what the session does.
 * Every callback runs on the session's serialized task thread.
 */
public interface SessionListener {

  /**
   * A system line for the operator.
   *
   * @param severity how prominently to show it
   * @param text     the text
   */
  void onSystemNotice(NoticeSeverity severity, String text);

  /**
   * A message from a peer was decrypted.
   *
   * @param senderId  the sender's session id
   * @param plaintext the plaintext
   */
  void onPeerMessage(String senderId, String plaintext);

  /**
   * The relay connection changed state.
   *
   * @param state the state
   */
  void onConnectionStateChange(ConnectionState state);
}
