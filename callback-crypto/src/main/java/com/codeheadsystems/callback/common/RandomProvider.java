package com.codeheadsystems.callback.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for the random frame prefix and for reply nonces.
 */
public class RandomProvider {

  private final SecureRandom random;

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Creates a RandomProvider with the given {@link SecureRandom}.
   *
   * @param random the random source to use
   */
  public RandomProvider(SecureRandom random) {
    this.random = random;
  }

  /**
   * Returns the underlying {@link SecureRandom}.
   *
   * @return the secure random
   */
  public SecureRandom random() {
    return random;
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates a string of {@code len} random decimal digits.
   *
   * @param len the number of digits
   * @return the digits
   */
  public String randomDigits(int len) {
    StringBuilder sb = new StringBuilder(len);
    for (int i = 0; i < len; i++) {
      sb.append((char) ('0' + random.nextInt(10)));
    }
    return sb.toString();
  }
}
