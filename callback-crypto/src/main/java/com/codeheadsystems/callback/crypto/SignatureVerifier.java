package com.codeheadsystems.callback.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Computes and checks the request signature: SHA-1 over the lexicographically sorted
 * concatenation of token, timestamp, nonce and ciphertext, rendered as lowercase hex.
 */
public final class SignatureVerifier {

  private SignatureVerifier() {
  }

  /**
   * Computes the signature for the four inputs. The argument order does not matter because the
   * inputs are sorted before hashing.
   *
   * @param token      the token
   * @param timestamp  the timestamp
   * @param nonce      the nonce
   * @param cipherBody the base64 ciphertext
   * @return lowercase hex SHA-1 digest
   */
  public static String computeSignature(String token, String timestamp, String nonce, String cipherBody) {
    String[] parts = {token, timestamp, nonce, cipherBody};
    for (String part : parts) {
      if (part == null) {
        throw new IllegalArgumentException("Signature inputs must not be null");
      }
    }
    Arrays.sort(parts);
    StringBuilder joined = new StringBuilder();
    for (String part : parts) {
      joined.append(part);
    }
    return Hex.toHexString(sha1(joined.toString().getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Checks a candidate signature in constant time.
   *
   * @param candidateSignature the signature supplied by the caller
   * @param token              the token
   * @param timestamp          the timestamp
   * @param nonce              the nonce
   * @param cipherBody         the base64 ciphertext
   * @return true if the signature matches; false otherwise, including when any input is null
   */
  public static boolean verify(String candidateSignature, String token, String timestamp,
                               String nonce, String cipherBody) {
    if (candidateSignature == null || token == null || timestamp == null
        || nonce == null || cipherBody == null) {
      return false;
    }
    byte[] expected = computeSignature(token, timestamp, nonce, cipherBody)
        .getBytes(StandardCharsets.US_ASCII);
    // Security: constant-time comparison prevents timing side-channel attacks on the signature
    return MessageDigest.isEqual(expected, candidateSignature.getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] sha1(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-1").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
