package com.codeheadsystems.tether.client.pkce;

import com.codeheadsystems.tether.model.Provider;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Generates PKCE verifier/challenge pairs and CSRF state values.
 * <p>
 * The verifier is the base64url encoding of 32 random bytes, which is always 43
 * characters and inside the 43..128 range RFC 7636 requires. The challenge uses the
 * {@code S256} method.
 */
@Singleton
public class PkceGenerator {

  /** Random bytes behind each verifier. */
  public static final int VERIFIER_BYTES = 32;

  private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Pkce generator with a default random source.
   */
  public PkceGenerator() {
    this(new RandomProvider());
  }

  /**
   * Instantiates a new Pkce generator.
   *
   * @param randomProvider the random provider
   */
  @Inject
  public PkceGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a new verifier and its challenge.
   *
   * @return the pair
   */
  public PkcePair generatePkce() {
    String verifier = base64Url(randomProvider.randomBytes(VERIFIER_BYTES));
    return new PkcePair(verifier, challengeFor(verifier));
  }

  /**
   * Generates a CSRF state for the provider, {@code "<PROVIDER>:<uuid>"}.
   *
   * @param provider the provider
   * @return the state
   */
  public String newState(final Provider provider) {
    return provider.statePrefix() + UUID.randomUUID();
  }

  /**
   * Derives the S256 challenge for a verifier.
   *
   * @param verifier the verifier
   * @return base64url of the SHA-256 digest of the verifier's UTF-8 bytes
   */
  public static String challengeFor(final String verifier) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return base64Url(digest.digest(verifier.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Base64url without padding (RFC 4648 §5). Empty input gives an empty string.
   *
   * @param bytes the bytes
   * @return the encoded string, alphabet {@code [A-Za-z0-9_-]}
   */
  public static String base64Url(final byte[] bytes) {
    return BASE64_URL.encodeToString(bytes);
  }
}
