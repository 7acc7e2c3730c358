package com.codeheadsystems.onyx.crypto.exceptions;

/**
 * Base type for every failure to seal or open an envelope.
 */
public class EnvelopeException extends RuntimeException {
  /**
   * Instantiates a new envelope exception.
   *
   * @param message the message
   */
  public EnvelopeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new envelope exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EnvelopeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
