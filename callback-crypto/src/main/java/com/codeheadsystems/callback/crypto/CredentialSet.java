package com.codeheadsystems.callback.crypto;

import com.codeheadsystems.callback.exceptions.ConfigException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * The shared secrets of one callback integration: the signing token, the encoded AES key, and
 * optionally the receiver id that inbound messages must be addressed to.
 * <p>
 * Both secrets are validated when the set is constructed, so a malformed configuration fails at
 * activation rather than on the first request. The {@link KeyMaterial} is derived on first use
 * and then shared by every request.
 */
public final class CredentialSet {

  private final String token;
  private final String encodedKey;
  private final String expectedReceiverId;

  private volatile KeyMaterial keyMaterial;

  /**
   * Instantiates a new Credential set.
   *
   * @param token              the signing token
   * @param encodedKey         the 43 character encoded AES key
   * @param expectedReceiverId the receiver id to enforce, or null / blank to skip the check
   * @throws ConfigException if the token is blank or the key is malformed
   */
  public CredentialSet(final String token, final String encodedKey, final String expectedReceiverId) {
    if (token == null || token.isBlank()) {
      throw new ConfigException("Token must not be blank");
    }
    KeyMaterial.validate(encodedKey);
    this.token = token;
    this.encodedKey = encodedKey;
    this.expectedReceiverId = (expectedReceiverId == null || expectedReceiverId.isEmpty())
        ? null : expectedReceiverId;
  }

  /**
   * Instantiates a new Credential set with no receiver check.
   *
   * @param token      the signing token
   * @param encodedKey the encoded key
   */
  public CredentialSet(final String token, final String encodedKey) {
    this(token, encodedKey, null);
  }

  /**
   * Token string.
   *
   * @return the string
   */
  public String token() {
    return token;
  }

  /**
   * The receiver id inbound events must carry, if configured.
   *
   * @return the optional
   */
  public Optional<String> expectedReceiverId() {
    return Optional.ofNullable(expectedReceiverId);
  }

  /**
   * The receiver id as UTF-8 bytes, or null when none is configured.
   *
   * @return the byte [ ]
   */
  public byte[] expectedReceiverIdBytes() {
    return expectedReceiverId == null ? null : expectedReceiverId.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Returns the key material, deriving it on the first call.
   *
   * @return the key material
   */
  public KeyMaterial keyMaterial() {
    KeyMaterial result = keyMaterial;
    if (result == null) {
      synchronized (this) {
        result = keyMaterial;
        if (result == null) {
          result = KeyMaterial.derive(encodedKey);
          keyMaterial = result;
        }
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "CredentialSet[token=redacted, encodedKey=redacted, expectedReceiverId="
        + expectedReceiverId + "]";
  }
}
