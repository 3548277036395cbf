package com.codeheadsystems.callback.crypto;

import com.codeheadsystems.callback.exceptions.ConfigException;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * The AES-256 key and CBC initialization vector derived from an encoded key.
 * <p>
 * The IV is always the first 16 bytes of the key. This is how the protocol is defined by the
 * vendor and must be reproduced for interoperability; it is not an independently generated IV.
 * Instances are immutable and may be shared across threads.
 */
public final class KeyMaterial {

  /**
   * Length of the encoded key, which omits its single trailing base64 pad character.
   */
  public static final int ENCODED_KEY_LENGTH = 43;

  /**
   * AES-256 key length in bytes.
   */
  public static final int KEY_LENGTH = 32;

  /**
   * CBC IV length in bytes.
   */
  public static final int IV_LENGTH = 16;

  private final byte[] key;
  private final byte[] iv;

  private KeyMaterial(byte[] key) {
    this.key = key;
    this.iv = Arrays.copyOf(key, IV_LENGTH);
  }

  /**
   * Derives key material from a 43 character base64 string.
   *
   * @param encodedKey the encoded key
   * @return the key material
   * @throws ConfigException if the input has the wrong length, contains characters outside the
   *                         base64 alphabet, or does not decode to exactly 32 bytes
   */
  public static KeyMaterial derive(String encodedKey) {
    return new KeyMaterial(decode(encodedKey));
  }

  /**
   * Checks an encoded key without keeping the decoded bytes.
   *
   * @param encodedKey the encoded key
   * @throws ConfigException if the key is invalid
   */
  static void validate(String encodedKey) {
    Arrays.fill(decode(encodedKey), (byte) 0);
  }

  private static byte[] decode(String encodedKey) {
    if (encodedKey == null || encodedKey.length() != ENCODED_KEY_LENGTH) {
      throw new ConfigException("Encoded key must be " + ENCODED_KEY_LENGTH + " characters");
    }
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(encodedKey + "=");
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Encoded key is not valid base64", e);
    }
    if (decoded.length != KEY_LENGTH) {
      Arrays.fill(decoded, (byte) 0);
      throw new ConfigException("Encoded key must decode to " + KEY_LENGTH + " bytes");
    }
    return decoded;
  }

  /**
   * Returns a copy of the 32 byte key.
   *
   * @return the byte [ ]
   */
  public byte[] key() {
    return key.clone();
  }

  /**
   * Returns a copy of the 16 byte IV.
   *
   * @return the byte [ ]
   */
  public byte[] iv() {
    return iv.clone();
  }

  SecretKeySpec secretKeySpec() {
    return new SecretKeySpec(key, "AES");
  }

  IvParameterSpec ivParameterSpec() {
    return new IvParameterSpec(iv);
  }

  @Override
  public String toString() {
    return "KeyMaterial[redacted]";
  }
}
