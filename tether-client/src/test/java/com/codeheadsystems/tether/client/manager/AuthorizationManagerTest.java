package com.codeheadsystems.tether.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tether.client.accessor.ConnectionAccessor;
import com.codeheadsystems.tether.client.browser.BrowserResult;
import com.codeheadsystems.tether.client.browser.BrowserSession;
import com.codeheadsystems.tether.client.callback.QueryParameters;
import com.codeheadsystems.tether.client.config.ClientConfig;
import com.codeheadsystems.tether.client.config.ProviderClientConfig;
import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.client.exceptions.AuthorizationException;
import com.codeheadsystems.tether.client.exceptions.ConnectionAccessorException;
import com.codeheadsystems.tether.client.pkce.PkceGenerator;
import com.codeheadsystems.tether.client.store.EphemeralKey;
import com.codeheadsystems.tether.client.store.InMemoryEphemeralStore;
import com.codeheadsystems.tether.client.store.Purpose;
import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Authorization manager test.
 */
@ExtendWith(MockitoExtension.class)
class AuthorizationManagerTest {

  private static final String REDIRECT = ClientConfig.DEFAULT_REDIRECT_URI;
  private static final ClientConfig CONFIG = new ClientConfig(URI.create("http://localhost:8080"), REDIRECT,
      Map.of(Provider.YOUTUBE, ProviderClientConfig.youtube("yt-client"),
          Provider.SPOTIFY, ProviderClientConfig.spotify("sp-client"),
          Provider.GMAIL, ProviderClientConfig.gmail("")));

  @Mock private ConnectionAccessor connectionAccessor;

  private InMemoryEphemeralStore store;
  private AtomicReference<URI> openedUrl;

  @BeforeEach
  void setUp() {
    store = new InMemoryEphemeralStore();
    openedUrl = new AtomicReference<>();
  }

  /**
   * A browser that records the URL it was asked to open and answers with whatever the
   * given function builds from the authorization URL's parameters.
   */
  private AuthorizationManager manager(Function<Map<String, String>, BrowserResult> browser) {
    BrowserSession session = (url, redirectUri) -> {
      openedUrl.set(url);
      // Flow secrets must exist while the browser is open
      Provider provider = Provider.SPOTIFY;
      if (url.toString().contains("client_id=yt-client")) {
        provider = Provider.YOUTUBE;
      }
      assertThat(store.get(EphemeralKey.of(provider, Purpose.CODE_VERIFIER))).isPresent();
      assertThat(store.get(EphemeralKey.of(provider, Purpose.OAUTH_STATE))).isPresent();
      return browser.apply(QueryParameters.parse(url.toString()));
    };
    return new AuthorizationManager(CONFIG, new PkceGenerator(), store, connectionAccessor, session);
  }

  private static BrowserResult redirectWith(String query) {
    return BrowserResult.success(REDIRECT + "?" + query);
  }

  @Test
  void connectProvider_success_exchangesAndCleansUp() {
    when(connectionAccessor.callback(any())).thenReturn(new CallbackResponse(true, Provider.SPOTIFY));
    AuthorizationManager manager = manager(params -> redirectWith("code=auth-code&state=" + params.get("state")));

    CallbackResponse response = manager.connectProvider(Provider.SPOTIFY);

    assertThat(response.success()).isTrue();
    ArgumentCaptor<CallbackRequest> captor = ArgumentCaptor.forClass(CallbackRequest.class);
    verify(connectionAccessor).callback(captor.capture());
    CallbackRequest request = captor.getValue();
    assertThat(request.code()).isEqualTo("auth-code");
    assertThat(request.redirectUri()).isEqualTo(REDIRECT);
    assertThat(request.codeVerifier()).hasSize(43);
    assertThat(PkceGenerator.challengeFor(request.codeVerifier()))
        .isEqualTo(QueryParameters.parse(openedUrl.get().toString()).get("code_challenge"));
    assertThat(store.size()).isZero();
  }

  @Test
  void connectProvider_registersTheStateItSendsToTheProvider() {
    when(connectionAccessor.callback(any())).thenReturn(new CallbackResponse(true, Provider.SPOTIFY));
    AuthorizationManager manager = manager(params -> redirectWith("code=c&state=" + params.get("state")));

    manager.connectProvider(Provider.SPOTIFY);

    Map<String, String> params = QueryParameters.parse(openedUrl.get().toString());
    verify(connectionAccessor).registerState(
        new RegisterStateRequest(Provider.SPOTIFY, params.get("state")));
    assertThat(params.get("state")).startsWith("SPOTIFY:");
  }

  @Test
  void connectProvider_spotifyUrl_hasStandardParametersOnly() {
    when(connectionAccessor.callback(any())).thenReturn(new CallbackResponse(true, Provider.SPOTIFY));
    AuthorizationManager manager = manager(params -> redirectWith("code=c&state=" + params.get("state")));

    manager.connectProvider(Provider.SPOTIFY);

    URI url = openedUrl.get();
    assertThat(url.toString()).startsWith("https://accounts.spotify.com/authorize?");
    assertThat(QueryParameters.parse(url.toString()))
        .containsEntry("client_id", "sp-client")
        .containsEntry("redirect_uri", REDIRECT)
        .containsEntry("response_type", "code")
        .containsEntry("scope", "user-library-read")
        .containsEntry("code_challenge_method", "S256")
        .containsKeys("state", "code_challenge")
        .doesNotContainKeys("access_type", "prompt");
  }

  @Test
  void connectProvider_youtubeUrl_requestsOfflineConsent() {
    when(connectionAccessor.callback(any())).thenReturn(new CallbackResponse(true, Provider.YOUTUBE));
    AuthorizationManager manager = manager(params -> redirectWith("code=c&state=" + params.get("state")));

    manager.connectProvider(Provider.YOUTUBE);

    assertThat(QueryParameters.parse(openedUrl.get().toString()))
        .containsEntry("access_type", "offline")
        .containsEntry("prompt", "consent")
        .containsEntry("scope", ProviderClientConfig.youtube("x").scopeParameter());
  }

  @Test
  void connectProvider_noClientId_failsWithoutTouchingAnything() {
    AuthorizationManager manager = manager(params -> BrowserResult.cancel());

    assertThatThrownBy(() -> manager.connectProvider(Provider.GMAIL))
        .isInstanceOfSatisfying(AuthorizationException.class,
            e -> assertThat(e.code()).isEqualTo(AuthorizationErrorCode.CONFIG_ERROR));
    verifyNoInteractions(connectionAccessor);
    assertThat(openedUrl.get()).isNull();
  }

  @Test
  void connectProvider_userCancels_flowCancelledAndCleansUp() {
    AuthorizationManager manager = manager(params -> BrowserResult.cancel());

    assertFails(manager, AuthorizationErrorCode.FLOW_CANCELLED);
    verify(connectionAccessor, never()).callback(any());
  }

  @Test
  void connectProvider_dismissed_flowCancelled() {
    AuthorizationManager manager = manager(params -> BrowserResult.dismiss());

    assertFails(manager, AuthorizationErrorCode.FLOW_CANCELLED);
  }

  @Test
  void connectProvider_providerError_usesDescriptionAndCleansUp() {
    AuthorizationManager manager = manager(params ->
        redirectWith("error=access_denied&error_description=User+said+no&state=" + params.get("state")));

    AuthorizationException e = assertFails(manager, AuthorizationErrorCode.PROVIDER_ERROR);

    assertThat(e.getMessage()).isEqualTo("User said no");
    assertThat(e.providerError()).isEqualTo("access_denied");
  }

  @Test
  void connectProvider_stateMismatch_csrfAndNoExchange() {
    AuthorizationManager manager = manager(params -> redirectWith("code=c&state=SPOTIFY:forged"));

    assertFails(manager, AuthorizationErrorCode.CSRF_MISMATCH);
    verify(connectionAccessor, never()).callback(any());
  }

  @Test
  void connectProvider_missingState_csrf() {
    AuthorizationManager manager = manager(params -> redirectWith("code=c"));

    assertFails(manager, AuthorizationErrorCode.CSRF_MISMATCH);
  }

  @Test
  void connectProvider_missingCode_missingCode() {
    AuthorizationManager manager = manager(params -> redirectWith("state=" + params.get("state")));

    assertFails(manager, AuthorizationErrorCode.MISSING_CODE);
  }

  @Test
  void connectProvider_badPercentEscape_malformedCallbackAndNoExchange() {
    AuthorizationManager manager = manager(params -> redirectWith("code=c%zz&state=" + params.get("state")));

    AuthorizationException e = assertFails(manager, AuthorizationErrorCode.MALFORMED_CALLBACK);

    assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
    verify(connectionAccessor, never()).callback(any());
  }

  @Test
  void connectProvider_verifierGone_verifierNotFound() {
    AuthorizationManager manager = manager(params -> {
      store.delete(EphemeralKey.of(Provider.SPOTIFY, Purpose.CODE_VERIFIER));
      return redirectWith("code=c&state=" + params.get("state"));
    });

    assertFails(manager, AuthorizationErrorCode.VERIFIER_NOT_FOUND);
  }

  @Test
  void connectProvider_exchangeFails_exchangeFailedAndCleansUp() {
    when(connectionAccessor.callback(any()))
        .thenThrow(new ConnectionAccessorException("Server returned HTTP 502", 502, null));
    AuthorizationManager manager = manager(params -> redirectWith("code=c&state=" + params.get("state")));

    AuthorizationException e = assertFails(manager, AuthorizationErrorCode.EXCHANGE_FAILED);

    assertThat(e.getCause()).isInstanceOf(ConnectionAccessorException.class);
  }

  @Test
  void connectProvider_registrationFails_registrationFailedAndCleansUp() {
    doThrow(new SecurityException("401")).when(connectionAccessor).registerState(any());
    AuthorizationManager manager = manager(params -> BrowserResult.cancel());

    assertFails(manager, AuthorizationErrorCode.REGISTRATION_FAILED);
    assertThat(openedUrl.get()).isNull();
  }

  private AuthorizationException assertFails(AuthorizationManager manager, AuthorizationErrorCode code) {
    AuthorizationException thrown = null;
    try {
      manager.connectProvider(Provider.SPOTIFY);
    } catch (AuthorizationException e) {
      thrown = e;
    }
    assertThat(thrown).as("expected %s", code).isNotNull();
    assertThat(thrown.code()).isEqualTo(code);
    assertThat(store.size()).as("ephemeral entries left behind").isZero();
    return thrown;
  }
}
