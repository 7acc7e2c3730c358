package com.codeheadsystems.onyx.client.accessor;

import com.codeheadsystems.onyx.client.exceptions.RelayAccessorException;

/**
 * A single persistent, line-oriented connection to the relay.
 */
public interface RelayAccessor {

  /**
   * Opens the connection and starts delivering received lines, in arrival order, to the listener.
   *
   * @param listener receives lines and the close notification
   * @throws RelayAccessorException if the connection cannot be opened
   */
  void open(Listener listener);

  /**
   * Writes one line. Fire-and-forget: no acknowledgement is awaited.
   *
   * @param line the line, without a trailing newline
   * @throws RelayAccessorException if the connection is closed or the write fails
   */
  void send(String line);

  /**
   * Whether frames can currently be sent.
   *
   * @return true if open
   */
  boolean isOpen();

  /**
   * Closes the connection. Idempotent.
   */
  void close();

  /**
   * Receives transport events.
   */
  interface Listener {

    /**
     * One line arrived.
     *
     * @param line the line, without its newline
     */
    void onLine(String line);

    /**
     * The connection ended. Called at most once.
     *
     * @param cause the failure, or null for an orderly close
     */
    void onClosed(Throwable cause);
  }
}
