package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * Sealing an outgoing envelope failed; the plaintext was not sent.
 */
public class EnvelopeEncryptionException extends EnvelopeException {
  /**
   * Instantiates a new envelope encryption exception.
   *
   * @param message the message
   */
  public EnvelopeEncryptionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new envelope encryption exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EnvelopeEncryptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
