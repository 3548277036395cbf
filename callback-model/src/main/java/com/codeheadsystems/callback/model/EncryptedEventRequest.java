package com.codeheadsystems.callback.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of an event callback: {@code {"encrypt": "<base64 ciphertext>"}}.
 * <p>
 * Vendors add routing fields next to {@code encrypt} (for example {@code ToUserName} or
 * {@code AgentID}); they are not authenticated and are ignored.
 * <p>
 * Used by: {@code POST /callback} request
 *
 * @param encrypt base64 AES-256-CBC ciphertext of the framed event payload
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptedEventRequest(@JsonProperty("encrypt") String encrypt) {

  @Override
  public String toString() {
    return "EncryptedEventRequest[encryptLength=" + (encrypt == null ? 0 : encrypt.length()) + "]";
  }
}
