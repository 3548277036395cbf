package com.codeheadsystems.callback.exceptions;

/**
 * The message decrypted correctly but is addressed to another integration instance.
 */
public class ReceiverMismatchException extends RejectedRequestException {

  /**
   * Instantiates a new Receiver mismatch exception.
   */
  public ReceiverMismatchException() {
    super(Reason.RECEIVER_MISMATCH, "Receiver id mismatch", null);
  }
}
