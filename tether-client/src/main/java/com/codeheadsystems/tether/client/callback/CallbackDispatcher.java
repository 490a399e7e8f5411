package com.codeheadsystems.tether.client.callback;

import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.client.manager.CompletionManager;
import com.codeheadsystems.tether.client.manager.CompletionResult;
import com.codeheadsystems.tether.model.Provider;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes OAuth redirect deep links to the {@link CompletionManager}.
 * <p>
 * URLs that are not OAuth callbacks are ordinary app traffic and are ignored without a
 * trace. Each callback URL is handled once even if the platform delivers it through both
 * the cold-start and the warm-start path. After handling, the user is always sent on via
 * the {@link Navigator}.
 */
@Singleton
public class CallbackDispatcher {

  /** Path fragment that identifies an OAuth redirect. */
  public static final String CALLBACK_PATH = "oauth/callback";

  private static final Logger log = LoggerFactory.getLogger(CallbackDispatcher.class);

  private final CompletionManager completionManager;
  private final Navigator navigator;
  private final Set<String> seenUrls = ConcurrentHashMap.newKeySet();

  /**
   * Instantiates a new Callback dispatcher.
   *
   * @param completionManager the completion manager
   * @param navigator         the navigator
   */
  @Inject
  public CallbackDispatcher(final CompletionManager completionManager, final Navigator navigator) {
    log.info("CallbackDispatcher()");
    this.completionManager = completionManager;
    this.navigator = navigator;
  }

  /**
   * Handles the cold-start URL and subscribes to warm-start URLs.
   *
   * @param source the source
   * @return the subscription; close it to stop listening
   */
  public DeepLinkSource.Subscription attach(final DeepLinkSource source) {
    source.initialUrl().ifPresent(this::dispatch);
    return source.subscribe(this::dispatch);
  }

  /**
   * Handles one inbound URL.
   *
   * @param url the url
   * @return the completion result, or empty if the URL was not a callback or was already handled
   */
  public Optional<CompletionResult> dispatch(final String url) {
    if (url == null || !isCallbackUrl(url)) {
      return Optional.empty();
    }
    if (!seenUrls.add(url)) {
      log.debug("Ignoring callback already handled");
      return Optional.empty();
    }
    CompletionResult result = handle(url);
    if (!result.success()) {
      log.warn("OAuth callback failed: provider={}, error={}, message={}",
          result.provider(), result.error(), result.message());
    }
    navigator.leaveCallback(result);
    return Optional.of(result);
  }

  /**
   * Whether the URL is an OAuth redirect.
   *
   * @param url the url
   * @return true if the part before the query contains {@value #CALLBACK_PATH}
   */
  public static boolean isCallbackUrl(final String url) {
    return QueryParameters.withoutQuery(url).contains(CALLBACK_PATH);
  }

  /**
   * The provider named by a state's prefix.
   *
   * @param state the state
   * @return the provider, or empty for a malformed state or unknown provider
   */
  public static Optional<Provider> providerFromState(final String state) {
    if (state == null) {
      return Optional.empty();
    }
    int colon = state.indexOf(':');
    if (colon <= 0) {
      return Optional.empty();
    }
    return Provider.fromName(state.substring(0, colon));
  }

  private CompletionResult handle(String url) {
    Map<String, String> params;
    try {
      params = QueryParameters.parse(url);
    } catch (IllegalArgumentException e) {
      return CompletionResult.failure(null, AuthorizationErrorCode.MALFORMED_CALLBACK,
          "Callback query could not be decoded: " + e.getMessage());
    }
    String state = params.get("state");
    Optional<Provider> provider = providerFromState(state);

    String error = params.get("error");
    if (error != null) {
      return CompletionResult.providerFailure(provider.orElse(null), error,
          params.getOrDefault("error_description", error));
    }
    if (provider.isEmpty()) {
      return CompletionResult.failure(null, AuthorizationErrorCode.UNKNOWN_PROVIDER,
          "Callback state does not name a known provider");
    }
    String code = params.get("code");
    if (code == null || code.isEmpty()) {
      return CompletionResult.failure(provider.get(), AuthorizationErrorCode.MISSING_CODE,
          "No authorization code in callback");
    }
    return completionManager.completeOAuthFlow(code, state, provider.get());
  }
}
