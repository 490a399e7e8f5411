package com.codeheadsystems.tether.client.config;

import com.codeheadsystems.tether.model.Provider;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Device-side configuration for one provider's authorization request.
 * <p>
 * Only public values live here. The client secret, if the provider issued one, stays on the
 * server.
 *
 * @param provider              the provider
 * @param clientId              the public OAuth client id; blank means the provider is not
 *                              configured for this build
 * @param authorizationEndpoint the provider's authorization endpoint
 * @param scopes                the scopes to request, joined with spaces in the URL
 * @param extraParameters       provider-specific query parameters appended after the standard ones
 */
public record ProviderClientConfig(Provider provider,
                                   String clientId,
                                   URI authorizationEndpoint,
                                   List<String> scopes,
                                   Map<String, String> extraParameters) {

  /** Google authorization endpoint, shared by YouTube and Gmail. */
  public static final URI GOOGLE_AUTHORIZATION_ENDPOINT =
      URI.create("https://accounts.google.com/o/oauth2/v2/auth");
  /** Spotify authorization endpoint. */
  public static final URI SPOTIFY_AUTHORIZATION_ENDPOINT =
      URI.create("https://accounts.spotify.com/authorize");

  // Google only issues a refresh token when offline access is requested with consent.
  private static final Map<String, String> GOOGLE_OFFLINE = offlineConsent();

  /**
   * Instantiates a new Provider client config.
   */
  public ProviderClientConfig {
    scopes = List.copyOf(scopes);
    extraParameters = Map.copyOf(extraParameters);
  }

  /**
   * YouTube (video provider) defaults.
   *
   * @param clientId the client id
   * @return the config
   */
  public static ProviderClientConfig youtube(String clientId) {
    return new ProviderClientConfig(Provider.YOUTUBE, clientId, GOOGLE_AUTHORIZATION_ENDPOINT,
        List.of("https://www.googleapis.com/auth/youtube.readonly",
            "https://www.googleapis.com/auth/userinfo.email",
            "https://www.googleapis.com/auth/userinfo.profile"),
        GOOGLE_OFFLINE);
  }

  /**
   * Spotify (audio provider) defaults.
   *
   * @param clientId the client id
   * @return the config
   */
  public static ProviderClientConfig spotify(String clientId) {
    return new ProviderClientConfig(Provider.SPOTIFY, clientId, SPOTIFY_AUTHORIZATION_ENDPOINT,
        List.of("user-library-read"), Map.of());
  }

  /**
   * Gmail (mail provider) defaults.
   *
   * @param clientId the client id
   * @return the config
   */
  public static ProviderClientConfig gmail(String clientId) {
    return new ProviderClientConfig(Provider.GMAIL, clientId, GOOGLE_AUTHORIZATION_ENDPOINT,
        List.of("https://www.googleapis.com/auth/gmail.readonly",
            "https://www.googleapis.com/auth/userinfo.email"),
        GOOGLE_OFFLINE);
  }

  /**
   * Whether a client id has been configured.
   *
   * @return true if usable
   */
  public boolean hasClientId() {
    return clientId != null && !clientId.isBlank();
  }

  /**
   * The scopes in the form the authorization URL expects.
   *
   * @return the space-joined scopes
   */
  public String scopeParameter() {
    return String.join(" ", scopes);
  }

  private static Map<String, String> offlineConsent() {
    Map<String, String> extras = new LinkedHashMap<>();
    extras.put("access_type", "offline");
    extras.put("prompt", "consent");
    return extras;
  }
}
