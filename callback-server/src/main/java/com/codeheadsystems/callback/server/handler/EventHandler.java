package com.codeheadsystems.callback.server.handler;

import java.util.Optional;

/**
 * Consumes decrypted callback events. Implementations apply their own per-event filters and
 * business logic.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles one event.
   *
   * @param event the event
   * @return the plaintext reply to encrypt and return to the caller, or empty to acknowledge
   */
  Optional<byte[]> handle(CallbackEvent event);
}
