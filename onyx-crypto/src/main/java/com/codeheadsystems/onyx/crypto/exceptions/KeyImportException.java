package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * A peer's PEM could not be parsed as an SPKI-encoded RSA public key.
 */
public class KeyImportException extends RuntimeException {
  /**
   * Instantiates a new key import exception.
   *
   * @param message the message
   */
  public KeyImportException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new key import exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyImportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
