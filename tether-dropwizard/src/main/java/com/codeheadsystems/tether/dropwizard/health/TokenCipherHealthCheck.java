package com.codeheadsystems.tether.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import com.codeheadsystems.tether.server.crypto.TokenCipher;
import com.codeheadsystems.tether.server.crypto.TokenCipherException;

/**
 * Health check that round-trips a sample value through the token cipher, so a broken key
 * configuration shows up before a refresh fails on it.
 */
public class TokenCipherHealthCheck extends HealthCheck {

  private static final String SAMPLE = "tether-health-sample";

  private final TokenCipher tokenCipher;

  /**
   * Instantiates a new Token cipher health check.
   *
   * @param tokenCipher the token cipher
   */
  public TokenCipherHealthCheck(TokenCipher tokenCipher) {
    this.tokenCipher = tokenCipher;
  }

  @Override
  protected Result check() {
    try {
      EncryptedToken encrypted = tokenCipher.encrypt(SAMPLE);
      if (!SAMPLE.equals(tokenCipher.decrypt(encrypted))) {
        return Result.unhealthy("Token cipher round trip returned a different value");
      }
      return Result.healthy("current key version ok");
    } catch (TokenCipherException e) {
      return Result.unhealthy("Token cipher failed: %s", e.code());
    }
  }
}
