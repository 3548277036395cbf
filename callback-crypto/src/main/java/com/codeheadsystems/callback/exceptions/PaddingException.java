package com.codeheadsystems.callback.exceptions;

/**
 * Ciphertext is not valid base64, is not a positive multiple of the block size, or its
 * PKCS#7 padding is malformed.
 */
public class PaddingException extends RejectedRequestException {

  /**
   * Instantiates a new Padding exception.
   *
   * @param message the message
   */
  public PaddingException(final String message) {
    super(Reason.PADDING, message, null);
  }

  /**
   * Instantiates a new Padding exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PaddingException(final String message, final Throwable cause) {
    super(Reason.PADDING, message, cause);
  }
}
