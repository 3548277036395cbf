package com.codeheadsystems.callback.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the callback endpoint.
 * <p>
 * The {@code token} and {@code encodedKey} come from the vendor's callback settings page.
 * Set {@code receiverId} (the corp id, or the bot id for bot callbacks) to reject events
 * encrypted for another receiver.
 */
public class CallbackConfiguration extends Configuration {

  /**
   * Shared secret bound into every request signature.
   */
  @NotEmpty
  private String token;

  /**
   * The 43-character EncodingAESKey.
   */
  @NotEmpty
  private String encodedKey;

  /**
   * Expected receiver id. Empty disables the receiver check on events.
   */
  private String receiverId = "";

  /**
   * PKCS#7 block size for sealed replies. 16 matches the AES block; the vendor's SDKs use 32.
   */
  @Min(16)
  @Max(240)
  private int paddingBlockSize = 16;

  /**
   * Gets token.
   *
   * @return the token
   */
  @JsonProperty
  public String getToken() {
    return token;
  }

  /**
   * Sets token.
   *
   * @param token the token
   */
  @JsonProperty
  public void setToken(String token) {
    this.token = token;
  }

  /**
   * Gets encoded key.
   *
   * @return the encoded key
   */
  @JsonProperty
  public String getEncodedKey() {
    return encodedKey;
  }

  /**
   * Sets encoded key.
   *
   * @param encodedKey the encoded key
   */
  @JsonProperty
  public void setEncodedKey(String encodedKey) {
    this.encodedKey = encodedKey;
  }

  /**
   * Gets receiver id.
   *
   * @return the receiver id
   */
  @JsonProperty
  public String getReceiverId() {
    return receiverId;
  }

  /**
   * Sets receiver id.
   *
   * @param receiverId the receiver id
   */
  @JsonProperty
  public void setReceiverId(String receiverId) {
    this.receiverId = receiverId;
  }

  @JsonProperty
  public int getPaddingBlockSize() {
    return paddingBlockSize;
  }

  @JsonProperty
  public void setPaddingBlockSize(int paddingBlockSize) {
    this.paddingBlockSize = paddingBlockSize;
  }
}
