package com.codeheadsystems.callback.crypto;

import java.nio.charset.StandardCharsets;

/**
 * The contents of a successfully opened envelope.
 *
 * @param payload    the payload bytes
 * @param receiverId the receiver id embedded after the payload
 */
public record DecryptedMessage(byte[] payload, byte[] receiverId) {

  /**
   * Payload decoded as UTF-8.
   *
   * @return the string
   */
  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  /**
   * Receiver id decoded as UTF-8.
   *
   * @return the string
   */
  public String receiverIdAsString() {
    return new String(receiverId, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "DecryptedMessage[payloadLength=" + payload.length
        + ", receiverIdLength=" + receiverId.length + "]";
  }
}
