package com.codeheadsystems.callback.exceptions;

/**
 * The decrypted plaintext does not hold a well-formed frame.
 */
public class FrameException extends RejectedRequestException {

  /**
   * Instantiates a new Frame exception.
   *
   * @param message the message
   */
  public FrameException(final String message) {
    super(Reason.FRAME, message, null);
  }
}
