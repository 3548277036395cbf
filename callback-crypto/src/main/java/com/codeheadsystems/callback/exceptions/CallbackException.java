package com.codeheadsystems.callback.exceptions;

/**
 * Root of the closed set of failures raised while configuring or processing callbacks.
 * <p>
 * Messages are fixed strings. They never carry key material, plaintext, or signature values,
 * so callers may log them, but should still answer the remote party with a generic message.
 */
public abstract class CallbackException extends RuntimeException {

  private final Reason reason;

  /**
   * Instantiates a new Callback exception.
   *
   * @param reason  the reason tag
   * @param message the message
   * @param cause   the cause, may be null
   */
  protected CallbackException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * The tag identifying the kind of failure.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Failure kinds.
   */
  public enum Reason {
    /**
     * Malformed token or key at configuration time. Fatal.
     */
    CONFIG,
    /**
     * The request signature did not match.
     */
    SIGNATURE_MISMATCH,
    /**
     * Ciphertext was not block aligned, not base64, or carried invalid PKCS#7 padding.
     */
    PADDING,
    /**
     * The decrypted frame was too short or its length field was inconsistent.
     */
    FRAME,
    /**
     * The frame was addressed to a different receiver.
     */
    RECEIVER_MISMATCH
  }
}
