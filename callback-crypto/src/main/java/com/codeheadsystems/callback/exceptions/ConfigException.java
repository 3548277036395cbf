package com.codeheadsystems.callback.exceptions;

/**
 * Raised when a token or encoded key is malformed. Blocks activation of the integration and is
 * never produced while handling a request.
 */
public class ConfigException extends CallbackException {

  /**
   * Instantiates a new Config exception.
   *
   * @param message the message
   */
  public ConfigException(final String message) {
    super(Reason.CONFIG, message, null);
  }

  /**
   * Instantiates a new Config exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigException(final String message, final Throwable cause) {
    super(Reason.CONFIG, message, cause);
  }
}
