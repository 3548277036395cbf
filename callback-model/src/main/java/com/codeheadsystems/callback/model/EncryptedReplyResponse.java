package com.codeheadsystems.callback.model;

import com.codeheadsystems.callback.handshake.SealedReply;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an encrypted passive reply to an event callback.
 * <p>
 * The caller authenticates the reply the same way the integration authenticates callbacks:
 * by recomputing the signature over its token, {@code timestamp}, {@code nonce} and
 * {@code encrypt}, then comparing it with {@code msgsignature}.
 * <p>
 * Used by: {@code POST /callback} response, when the event handler produced a reply
 *
 * @param encrypt      base64 ciphertext of the framed reply
 * @param msgSignature hex SHA-1 signature
 * @param timestamp    epoch seconds the reply was signed at
 * @param nonce        random nonce bound into the signature
 */
public record EncryptedReplyResponse(@JsonProperty("encrypt") String encrypt,
                                     @JsonProperty("msgsignature") String msgSignature,
                                     @JsonProperty("timestamp") String timestamp,
                                     @JsonProperty("nonce") String nonce) {

  /**
   * Instantiates a new Encrypted reply response from a sealed reply.
   *
   * @param reply the reply
   */
  public EncryptedReplyResponse(SealedReply reply) {
    this(reply.cipherBody(), reply.signature(), reply.timestamp(), reply.nonce());
  }
}
