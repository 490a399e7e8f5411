package com.codeheadsystems.tether.client.config;

import com.codeheadsystems.tether.model.Provider;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Client-side configuration: where the tether server lives, which redirect URI the
 * provider sends the browser back to, and the per-provider authorization settings.
 *
 * @param serverEndpoint base URL of the tether server, e.g. {@code https://api.example.com}
 * @param redirectUri    the registered redirect URI; its path must contain
 *                       {@code oauth/callback} for the deep-link dispatcher to pick it up
 * @param providers      per-provider configuration
 */
public record ClientConfig(URI serverEndpoint,
                           String redirectUri,
                           Map<Provider, ProviderClientConfig> providers) {

  /** Redirect URI used unless a build overrides it. */
  public static final String DEFAULT_REDIRECT_URI = "tether://oauth/callback";

  /**
   * Instantiates a new Client config.
   */
  public ClientConfig {
    providers = Map.copyOf(providers);
  }

  /**
   * Configuration with the default redirect URI and every provider's default settings.
   *
   * @param serverEndpoint   the server endpoint
   * @param youtubeClientId  the youtube client id, may be blank
   * @param spotifyClientId  the spotify client id, may be blank
   * @param gmailClientId    the gmail client id, may be blank
   * @return the client config
   */
  public static ClientConfig withDefaults(URI serverEndpoint,
                                          String youtubeClientId,
                                          String spotifyClientId,
                                          String gmailClientId) {
    return new ClientConfig(serverEndpoint, DEFAULT_REDIRECT_URI, Map.of(
        Provider.YOUTUBE, ProviderClientConfig.youtube(youtubeClientId),
        Provider.SPOTIFY, ProviderClientConfig.spotify(spotifyClientId),
        Provider.GMAIL, ProviderClientConfig.gmail(gmailClientId)));
  }

  /**
   * Returns the settings for a provider.
   *
   * @param provider the provider
   * @return the settings, or empty if the provider is not configured at all
   */
  public Optional<ProviderClientConfig> provider(Provider provider) {
    return Optional.ofNullable(providers.get(provider));
  }
}
