package com.codeheadsystems.callback.handshake;

/**
 * The authenticated parts of one inbound request: the three signature parameters and the base64
 * ciphertext (the {@code echostr} of a verification challenge, or the extracted body of an event
 * callback).
 *
 * @param signature  hex signature supplied by the caller
 * @param timestamp  the timestamp parameter
 * @param nonce      the nonce parameter
 * @param cipherBody the base64 ciphertext
 */
public record Envelope(String signature, String timestamp, String nonce, String cipherBody) {

  @Override
  public String toString() {
    return "Envelope[timestamp=" + timestamp + ", nonce=" + nonce + "]";
  }
}
