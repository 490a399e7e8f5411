package com.codeheadsystems.tether.server.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A provider token endpoint's success response (RFC 6749 §5.1).
 *
 * @param accessToken  the access token
 * @param expiresIn    lifetime in seconds, null if the provider did not say
 * @param refreshToken a new refresh token, null if not issued or not rotated
 * @param scope        granted scopes, may be null
 * @param tokenType    usually {@code Bearer}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope,
    @JsonProperty("token_type") String tokenType) {

  /** Lifetime assumed when the provider omits {@code expires_in}. */
  public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  /** Longest lifetime accepted from a provider: one year. */
  public static final long MAX_EXPIRES_IN_SECONDS = 365L * 24 * 60 * 60;

  /**
   * The lifetime in seconds.
   *
   * @return expires_in or the default
   */
  public long expiresInSeconds() {
    return expiresIn == null ? DEFAULT_EXPIRES_IN_SECONDS : expiresIn;
  }

  /**
   * Whether the lifetime is positive and no longer than {@link #MAX_EXPIRES_IN_SECONDS}.
   *
   * @return true if the expiry can be stored
   */
  public boolean hasUsableLifetime() {
    long seconds = expiresInSeconds();
    return seconds > 0 && seconds <= MAX_EXPIRES_IN_SECONDS;
  }

  @Override
  public String toString() {
    return "TokenResponse[expiresIn=" + expiresIn + ", rotated=" + (refreshToken != null)
        + ", scope=" + scope + "]";
  }
}
