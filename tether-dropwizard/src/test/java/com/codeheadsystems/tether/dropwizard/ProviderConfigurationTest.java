package com.codeheadsystems.tether.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import java.net.URI;
import org.junit.jupiter.api.Test;

class ProviderConfigurationTest {

  @Test
  void toSettings_withoutOverrides_usesProviderDefaults() {
    ProviderConfiguration config = new ProviderConfiguration();
    config.setClientId("google-client");

    ProviderSettings settings = config.toSettings(Provider.GMAIL);

    assertThat(settings.provider()).isEqualTo(Provider.GMAIL);
    assertThat(settings.clientId()).isEqualTo("google-client");
    assertThat(settings.tokenEndpoint()).isEqualTo(ProviderSettings.GOOGLE_TOKEN_ENDPOINT);
    assertThat(settings.revokeEndpoint()).isEqualTo(ProviderSettings.GOOGLE_REVOKE_ENDPOINT);
    assertThat(settings.hasClientSecret()).isFalse();
    assertThat(settings.clientSecret()).isNull();
  }

  @Test
  void toSettings_overridesEndpointsAndKeepsSecret() {
    ProviderConfiguration config = new ProviderConfiguration();
    config.setClientId("spotify-client");
    config.setClientSecret("shh");
    config.setTokenEndpoint(URI.create("http://localhost:9999/token"));

    ProviderSettings settings = config.toSettings(Provider.SPOTIFY);

    assertThat(settings.tokenEndpoint()).isEqualTo(URI.create("http://localhost:9999/token"));
    assertThat(settings.userInfoEndpoint()).isEqualTo(ProviderSettings.SPOTIFY_USER_INFO_ENDPOINT);
    assertThat(settings.revokeEndpoint()).isNull();
    assertThat(settings.clientSecret()).isEqualTo("shh");
    assertThat(settings.toString()).doesNotContain("shh");
  }
}
