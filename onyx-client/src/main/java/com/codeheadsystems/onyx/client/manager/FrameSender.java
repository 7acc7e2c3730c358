package com.codeheadsystems.onyx.client.manager;

import com.codeheadsystems.onyx.model.Frame;

/**
 * Hands an outgoing frame to the transport.
 */
@FunctionalInterface
public interface FrameSender {

  /**
   * Sends the frame.
   *
   * @param frame the frame
   * @return true if the frame was written to an open connection
   */
  boolean send(Frame frame);
}
