package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * Generating or exporting this participant's key pair failed. Fatal to the session.
 */
public class KeyGenerationException extends RuntimeException {
  /**
   * Instantiates a new key generation exception.
   *
   * @param message the message
   */
  public KeyGenerationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new key generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyGenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
