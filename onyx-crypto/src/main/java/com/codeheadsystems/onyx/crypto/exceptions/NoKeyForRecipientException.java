package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * The envelope carries no wrapped key for this identity. Expected when overhearing traffic addressed to others.
 */
public class NoKeyForRecipientException extends EnvelopeException {
  /**
   * Instantiates a new no key for recipient exception.
   *
   * @param message the message
   */
  public NoKeyForRecipientException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new no key for recipient exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public NoKeyForRecipientException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
