package com.codeheadsystems.tether.server.provider;

import com.codeheadsystems.tether.model.Provider;
import java.net.URI;
import java.util.Objects;

/**
 * Server-side configuration for talking to one provider's OAuth endpoints.
 *
 * @param provider         the provider
 * @param tokenEndpoint    token endpoint for code exchange and refresh
 * @param clientId         OAuth client id
 * @param clientSecret     client secret, or null for PKCE-only public clients
 * @param userInfoEndpoint endpoint returning the user's provider id, or null
 * @param revokeEndpoint   token revocation endpoint, or null if the provider has none
 */
public record ProviderSettings(Provider provider,
                               URI tokenEndpoint,
                               String clientId,
                               String clientSecret,
                               URI userInfoEndpoint,
                               URI revokeEndpoint) {

  /** Google token endpoint. */
  public static final URI GOOGLE_TOKEN_ENDPOINT = URI.create("https://oauth2.googleapis.com/token");
  /** Google user info endpoint. */
  public static final URI GOOGLE_USER_INFO_ENDPOINT = URI.create("https://www.googleapis.com/oauth2/v2/userinfo");
  /** Google revocation endpoint. */
  public static final URI GOOGLE_REVOKE_ENDPOINT = URI.create("https://oauth2.googleapis.com/revoke");
  /** Spotify token endpoint. */
  public static final URI SPOTIFY_TOKEN_ENDPOINT = URI.create("https://accounts.spotify.com/api/token");
  /** Spotify current-user endpoint. */
  public static final URI SPOTIFY_USER_INFO_ENDPOINT = URI.create("https://api.spotify.com/v1/me");

  /**
   * Instantiates a new Provider settings.
   */
  public ProviderSettings {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId is required for " + provider);
    }
  }

  /**
   * The provider's public endpoints with the given credentials.
   *
   * @param provider     the provider
   * @param clientId     the client id
   * @param clientSecret the client secret, may be null
   * @return the provider settings
   */
  public static ProviderSettings defaults(Provider provider, String clientId, String clientSecret) {
    return switch (provider) {
      case YOUTUBE, GMAIL -> new ProviderSettings(provider, GOOGLE_TOKEN_ENDPOINT, clientId, clientSecret,
          GOOGLE_USER_INFO_ENDPOINT, GOOGLE_REVOKE_ENDPOINT);
      case SPOTIFY -> new ProviderSettings(provider, SPOTIFY_TOKEN_ENDPOINT, clientId, clientSecret,
          SPOTIFY_USER_INFO_ENDPOINT, null);
    };
  }

  /**
   * Whether a client secret is configured.
   *
   * @return true if the secret should be sent
   */
  public boolean hasClientSecret() {
    return clientSecret != null && !clientSecret.isEmpty();
  }

  @Override
  public String toString() {
    return "ProviderSettings[provider=" + provider + ", tokenEndpoint=" + tokenEndpoint
        + ", clientSecret=" + (hasClientSecret() ? "***" : "none") + "]";
  }
}
