package com.codeheadsystems.tether.client.manager;

import com.codeheadsystems.tether.client.accessor.ConnectionAccessor;
import com.codeheadsystems.tether.client.config.ClientConfig;
import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.client.store.EphemeralKey;
import com.codeheadsystems.tether.client.store.EphemeralStore;
import com.codeheadsystems.tether.client.store.Purpose;
import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.Provider;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes an authorization whose redirect arrived as a deep link rather than through the
 * browser session, e.g. when the operating system restarted the app to deliver it.
 */
@Singleton
public class CompletionManager {

  private static final Logger log = LoggerFactory.getLogger(CompletionManager.class);

  private final ClientConfig clientConfig;
  private final EphemeralStore ephemeralStore;
  private final ConnectionAccessor connectionAccessor;

  /**
   * Instantiates a new Completion manager.
   *
   * @param clientConfig       the client config
   * @param ephemeralStore     the ephemeral store
   * @param connectionAccessor the connection accessor
   */
  @Inject
  public CompletionManager(final ClientConfig clientConfig,
                           final EphemeralStore ephemeralStore,
                           final ConnectionAccessor connectionAccessor) {
    log.info("CompletionManager()");
    this.clientConfig = clientConfig;
    this.ephemeralStore = ephemeralStore;
    this.connectionAccessor = connectionAccessor;
  }

  /**
   * Validates the state, exchanges the code and clears the provider's ephemeral entries.
   *
   * @param code     the authorization code
   * @param state    the state from the redirect
   * @param provider the provider the state names
   * @return the result; never throws for flow failures
   */
  public CompletionResult completeOAuthFlow(final String code, final String state, final Provider provider) {
    log.debug("completeOAuthFlow(provider={})", provider);
    try {
      Optional<String> storedState = ephemeralStore.get(EphemeralKey.of(provider, Purpose.OAUTH_STATE));
      if (storedState.isEmpty() || !storedState.get().equals(state)) {
        log.warn("State mismatch for {}", provider);
        return CompletionResult.failure(provider, AuthorizationErrorCode.CSRF_MISMATCH,
            "State does not match the stored state");
      }
      Optional<String> verifier = ephemeralStore.get(EphemeralKey.of(provider, Purpose.CODE_VERIFIER));
      if (verifier.isEmpty()) {
        log.warn("No stored verifier for {}", provider);
        return CompletionResult.failure(provider, AuthorizationErrorCode.VERIFIER_NOT_FOUND,
            "Authorization session expired");
      }
      connectionAccessor.callback(
          new CallbackRequest(provider, code, state, verifier.get(), clientConfig.redirectUri()));
      return CompletionResult.success(provider);
    } catch (RuntimeException e) {
      log.warn("Token exchange failed for {}", provider, e);
      return CompletionResult.failure(provider, AuthorizationErrorCode.EXCHANGE_FAILED, e.getMessage());
    } finally {
      clear(provider);
    }
  }

  private void clear(Provider provider) {
    try {
      ephemeralStore.deleteAll(provider);
    } catch (RuntimeException e) {
      log.error("Unable to clear ephemeral entries for {}", provider, e);
    }
  }
}
