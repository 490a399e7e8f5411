package com.codeheadsystems.tether.dropwizard;

import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.net.URI;

/**
 * One provider's server-side OAuth client registration.
 * <p>
 * Endpoints default to the provider's public ones; override them to point at a proxy or a
 * test double.
 */
public class ProviderConfiguration {

  @NotEmpty
  private String clientId;

  /** Leave empty for PKCE-only public clients. */
  private String clientSecret = "";

  private URI tokenEndpoint;

  private URI userInfoEndpoint;

  private URI revokeEndpoint;

  /**
   * Builds the settings the server core uses.
   *
   * @param provider the provider this block is keyed under
   * @return the provider settings
   */
  public ProviderSettings toSettings(Provider provider) {
    ProviderSettings defaults = ProviderSettings.defaults(provider, clientId, clientSecret);
    return new ProviderSettings(provider,
        tokenEndpoint == null ? defaults.tokenEndpoint() : tokenEndpoint,
        clientId,
        clientSecret == null || clientSecret.isEmpty() ? null : clientSecret,
        userInfoEndpoint == null ? defaults.userInfoEndpoint() : userInfoEndpoint,
        revokeEndpoint == null ? defaults.revokeEndpoint() : revokeEndpoint);
  }

  @JsonProperty
  public String getClientId() {
    return clientId;
  }

  @JsonProperty
  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  @JsonProperty
  public String getClientSecret() {
    return clientSecret;
  }

  @JsonProperty
  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  @JsonProperty
  public URI getTokenEndpoint() {
    return tokenEndpoint;
  }

  @JsonProperty
  public void setTokenEndpoint(URI tokenEndpoint) {
    this.tokenEndpoint = tokenEndpoint;
  }

  @JsonProperty
  public URI getUserInfoEndpoint() {
    return userInfoEndpoint;
  }

  @JsonProperty
  public void setUserInfoEndpoint(URI userInfoEndpoint) {
    this.userInfoEndpoint = userInfoEndpoint;
  }

  @JsonProperty
  public URI getRevokeEndpoint() {
    return revokeEndpoint;
  }

  @JsonProperty
  public void setRevokeEndpoint(URI revokeEndpoint) {
    this.revokeEndpoint = revokeEndpoint;
  }
}
