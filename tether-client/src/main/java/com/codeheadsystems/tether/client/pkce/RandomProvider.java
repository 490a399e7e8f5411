package com.codeheadsystems.tether.client.pkce;

import java.security.SecureRandom;

/**
 * Source of cryptographic randomness. Injectable so tests can pin the generator.
 */
public class RandomProvider {

  private final SecureRandom random;

  /**
   * Instantiates a new Random provider backed by a fresh {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Instantiates a new Random provider.
   *
   * @param random the random
   */
  public RandomProvider(SecureRandom random) {
    this.random = random;
  }

  /**
   * The underlying generator.
   *
   * @return the secure random
   */
  public SecureRandom random() {
    return random;
  }

  /**
   * Returns {@code length} random bytes.
   *
   * @param length the number of bytes
   * @return the bytes
   */
  public byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
