package com.codeheadsystems.callback.server.handler;

import java.nio.charset.StandardCharsets;

/**
 * An authenticated, decrypted event handed to an {@link EventHandler}.
 *
 * @param payload    the decrypted payload (JSON for the bot callback, XML for application callbacks)
 * @param receiverId the receiver id embedded in the frame
 * @param timestamp  the request timestamp
 * @param nonce      the request nonce
 */
public record CallbackEvent(byte[] payload, String receiverId, String timestamp, String nonce) {

  /**
   * Payload decoded as UTF-8.
   *
   * @return the string
   */
  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "CallbackEvent[payloadLength=" + payload.length + ", receiverId=" + receiverId
        + ", timestamp=" + timestamp + "]";
  }
}
