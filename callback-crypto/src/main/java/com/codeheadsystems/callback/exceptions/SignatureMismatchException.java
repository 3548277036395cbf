package com.codeheadsystems.callback.exceptions;

/**
 * The recomputed request signature did not match the one supplied.
 */
public class SignatureMismatchException extends RejectedRequestException {

  /**
   * Instantiates a new Signature mismatch exception.
   */
  public SignatureMismatchException() {
    super(Reason.SIGNATURE_MISMATCH, "Signature verification failed", null);
  }
}
