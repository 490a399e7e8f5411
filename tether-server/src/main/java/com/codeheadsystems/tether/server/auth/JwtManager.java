package com.codeheadsystems.tether.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the HMAC-SHA256 bearer tokens that identify end users to the
 * connection endpoints. The subject is the user id.
 */
public class JwtManager {

  /** Minimum HMAC secret length in bytes. */
  public static final int MIN_SECRET_BYTES = 32;

  private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new JwtManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   * @param clock      clock used for issued-at and expiry
   */
  public JwtManager(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    log.info("JwtManager(issuer={}, ttlSeconds={})", issuer, ttlSeconds);
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a JWT for a user.
   *
   * @param userId the user id
   * @return signed JWT string
   */
  public String issueToken(String userId) {
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(userId)
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued JWT jti={} for user {}", jti, userId);
    return token;
  }

  /**
   * Result of a successful JWT verification.
   *
   * @param subject the user id
   * @param jti     the JWT ID
   */
  public record VerifyResult(String subject, String jti) {
  }

  /**
   * Verifies a JWT.
   *
   * @param token JWT string
   * @return verify result if valid, empty otherwise
   */
  public Optional<VerifyResult> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      if (decoded.getSubject() == null || decoded.getSubject().isBlank()) {
        log.debug("JWT jti={} has no subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), decoded.getId()));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
