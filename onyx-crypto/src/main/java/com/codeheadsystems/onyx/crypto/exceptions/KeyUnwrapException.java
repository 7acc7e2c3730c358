package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * The wrapped symmetric key could not be recovered with this identity's private key.
 */
public class KeyUnwrapException extends EnvelopeException {
  /**
   * Instantiates a new key unwrap exception.
   *
   * @param message the message
   */
  public KeyUnwrapException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new key unwrap exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyUnwrapException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
