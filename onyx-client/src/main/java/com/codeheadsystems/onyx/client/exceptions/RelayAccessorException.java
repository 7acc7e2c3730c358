package com.codeheadsystems.onyx.client.exceptions;

/**
 * The relay connection could not be opened, or a frame could not be written to it.
 */
public class RelayAccessorException extends RuntimeException {
  /**
   * Instantiates a new Relay accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RelayAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
