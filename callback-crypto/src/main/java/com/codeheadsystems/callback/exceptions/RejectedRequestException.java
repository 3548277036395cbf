package com.codeheadsystems.callback.exceptions;

/**
 * Per-request rejection. The request is evaluated once; there is no retry at this layer.
 * Adapters map every subclass to an HTTP 400 class response.
 */
public abstract class RejectedRequestException extends CallbackException {

  /**
   * Instantiates a new Rejected request exception.
   *
   * @param reason  the reason
   * @param message the message
   * @param cause   the cause, may be null
   */
  protected RejectedRequestException(final Reason reason, final String message, final Throwable cause) {
    super(reason, message, cause);
  }
}
