package com.codeheadsystems.onyx.model;

/**
 * A frame could not be serialized for sending.
 */
public class FrameCodecException extends RuntimeException {
  /**
   * Instantiates a new Frame codec exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public FrameCodecException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
