package com.codeheadsystems.callback.handshake;

/**
 * An encrypted reply together with the signature triple the caller needs to authenticate it.
 *
 * @param cipherBody base64 ciphertext
 * @param signature  hex signature over token, timestamp, nonce and ciphertext
 * @param timestamp  epoch seconds as a string
 * @param nonce      the nonce
 */
public record SealedReply(String cipherBody, String signature, String timestamp, String nonce) {
}
