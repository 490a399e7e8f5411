package com.codeheadsystems.tether.client.manager;

import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.CONFIG_ERROR;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.CSRF_MISMATCH;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.EXCHANGE_FAILED;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.FLOW_CANCELLED;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.MALFORMED_CALLBACK;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.MISSING_CODE;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.PROVIDER_ERROR;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.REGISTRATION_FAILED;
import static com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode.VERIFIER_NOT_FOUND;

import com.codeheadsystems.tether.client.accessor.ConnectionAccessor;
import com.codeheadsystems.tether.client.browser.BrowserResult;
import com.codeheadsystems.tether.client.browser.BrowserSession;
import com.codeheadsystems.tether.client.callback.QueryParameters;
import com.codeheadsystems.tether.client.config.ClientConfig;
import com.codeheadsystems.tether.client.config.ProviderClientConfig;
import com.codeheadsystems.tether.client.exceptions.AuthorizationException;
import com.codeheadsystems.tether.client.pkce.PkceGenerator;
import com.codeheadsystems.tether.client.pkce.PkcePair;
import com.codeheadsystems.tether.client.store.EphemeralKey;
import com.codeheadsystems.tether.client.store.EphemeralStore;
import com.codeheadsystems.tether.client.store.Purpose;
import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the device side of an authorization-code-with-PKCE flow for one provider.
 * <p>
 * The device never sees a client secret. It sends the PKCE challenge to the provider, gets
 * an authorization code back through the browser redirect, and hands code and verifier to
 * the tether server, which performs the exchange and keeps the tokens.
 * <p>
 * Whatever happens, the verifier and state written for the flow are deleted before
 * {@link #connectProvider(Provider)} returns or throws.
 */
@Singleton
public class AuthorizationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationManager.class);

  private final ClientConfig clientConfig;
  private final PkceGenerator pkceGenerator;
  private final EphemeralStore ephemeralStore;
  private final ConnectionAccessor connectionAccessor;
  private final BrowserSession browserSession;

  /**
   * Instantiates a new Authorization manager.
   *
   * @param clientConfig       the client config
   * @param pkceGenerator      the pkce generator
   * @param ephemeralStore     the ephemeral store
   * @param connectionAccessor the connection accessor
   * @param browserSession     the browser session
   */
  @Inject
  public AuthorizationManager(final ClientConfig clientConfig,
                              final PkceGenerator pkceGenerator,
                              final EphemeralStore ephemeralStore,
                              final ConnectionAccessor connectionAccessor,
                              final BrowserSession browserSession) {
    log.info("AuthorizationManager()");
    this.clientConfig = clientConfig;
    this.pkceGenerator = pkceGenerator;
    this.ephemeralStore = ephemeralStore;
    this.connectionAccessor = connectionAccessor;
    this.browserSession = browserSession;
  }

  /**
   * Connects the signed-in user to a provider.
   *
   * @param provider the provider
   * @return the server's confirmation
   * @throws AuthorizationException when the flow fails for any reason
   */
  public CallbackResponse connectProvider(final Provider provider) {
    log.debug("connectProvider(provider={})", provider);
    ProviderClientConfig providerConfig = clientConfig.provider(provider)
        .filter(ProviderClientConfig::hasClientId)
        .orElseThrow(() -> new AuthorizationException(CONFIG_ERROR,
            "No client id configured for " + provider));

    EphemeralKey verifierKey = EphemeralKey.of(provider, Purpose.CODE_VERIFIER);
    EphemeralKey stateKey = EphemeralKey.of(provider, Purpose.OAUTH_STATE);
    try {
      // PKCE pair; only the challenge leaves the device before the exchange
      PkcePair pkce = pkceGenerator.generatePkce();
      ephemeralStore.set(verifierKey, pkce.verifier());

      // CSRF state bound to the user on the server, and kept locally
      String state = pkceGenerator.newState(provider);
      registerState(provider, state);
      ephemeralStore.set(stateKey, state);

      // Authorization URL
      URI authorizationUrl = buildAuthorizationUrl(providerConfig, clientConfig.redirectUri(),
          state, pkce.challenge());

      // Browser session
      BrowserResult result = browserSession.authorize(authorizationUrl, clientConfig.redirectUri());
      if (!result.isSuccess()) {
        throw new AuthorizationException(FLOW_CANCELLED,
            "Authorization for " + provider + " ended with " + result.type());
      }

      // Validate the redirect
      Map<String, String> params = parseRedirect(result.url());
      String error = params.get("error");
      if (error != null) {
        String description = params.getOrDefault("error_description", error);
        throw new AuthorizationException(PROVIDER_ERROR, description, error, null);
      }
      String returnedState = params.get("state");
      Optional<String> storedState = ephemeralStore.get(stateKey);
      if (returnedState == null || storedState.isEmpty() || !storedState.get().equals(returnedState)) {
        throw new AuthorizationException(CSRF_MISMATCH,
            "Returned state does not match the state issued for " + provider);
      }
      String code = params.get("code");
      if (code == null || code.isEmpty()) {
        throw new AuthorizationException(MISSING_CODE, "No authorization code in redirect");
      }
      String verifier = ephemeralStore.get(verifierKey)
          .orElseThrow(() -> new AuthorizationException(VERIFIER_NOT_FOUND,
              "PKCE verifier for " + provider + " is missing"));

      // Server-side exchange
      return exchange(new CallbackRequest(provider, code, returnedState, verifier,
          clientConfig.redirectUri()));
    } finally {
      ephemeralStore.delete(verifierKey);
      ephemeralStore.delete(stateKey);
    }
  }

  /**
   * Builds the provider authorization URL. Standard parameters come first, then the
   * provider's extras.
   *
   * @param providerConfig the provider config
   * @param redirectUri    the redirect uri
   * @param state          the state
   * @param codeChallenge  the code challenge
   * @return the authorization url
   */
  public static URI buildAuthorizationUrl(final ProviderClientConfig providerConfig,
                                          final String redirectUri,
                                          final String state,
                                          final String codeChallenge) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("client_id", providerConfig.clientId());
    params.put("redirect_uri", redirectUri);
    params.put("response_type", "code");
    params.put("scope", providerConfig.scopeParameter());
    params.put("state", state);
    params.put("code_challenge", codeChallenge);
    params.put("code_challenge_method", "S256");
    providerConfig.extraParameters().forEach(params::putIfAbsent);
    return URI.create(providerConfig.authorizationEndpoint() + "?" + QueryParameters.encode(params));
  }

  private static Map<String, String> parseRedirect(String url) {
    try {
      return QueryParameters.parse(url);
    } catch (IllegalArgumentException e) {
      throw new AuthorizationException(MALFORMED_CALLBACK,
          "Redirect query could not be decoded: " + e.getMessage(), e);
    }
  }

    private void registerState(Provider provider, String state) {
    try {
      connectionAccessor.registerState(new RegisterStateRequest(provider, state));
    } catch (RuntimeException e) {
      throw new AuthorizationException(REGISTRATION_FAILED,
          "Unable to register state for " + provider + ": " + e.getMessage(), e);
    }
  }

  private CallbackResponse exchange(CallbackRequest request) {
    try {
      return connectionAccessor.callback(request);
    } catch (RuntimeException e) {
      throw new AuthorizationException(EXCHANGE_FAILED,
          "Token exchange failed for " + request.provider() + ": " + e.getMessage(), e);
    }
  }
}
