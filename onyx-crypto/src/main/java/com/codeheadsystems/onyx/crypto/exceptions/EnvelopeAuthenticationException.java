package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * The AES-GCM tag did not verify: the ciphertext, tag or IV was altered or belongs to another key.
 */
public class EnvelopeAuthenticationException extends EnvelopeException {
  /**
   * Instantiates a new envelope authentication exception.
   *
   * @param message the message
   */
  public EnvelopeAuthenticationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new envelope authentication exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EnvelopeAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
