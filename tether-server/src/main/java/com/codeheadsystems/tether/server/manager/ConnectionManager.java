package com.codeheadsystems.tether.server.manager;

import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.ConnectionSummary;
import com.codeheadsystems.tether.model.ConnectionsResponse;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import com.codeheadsystems.tether.server.crypto.TokenCipher;
import com.codeheadsystems.tether.server.crypto.TokenCipherException;
import com.codeheadsystems.tether.server.exceptions.ConnectionNotFoundException;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import com.codeheadsystems.tether.server.provider.ProviderTokenAccessor;
import com.codeheadsystems.tether.server.provider.ProviderTokenException;
import com.codeheadsystems.tether.server.provider.TokenResponse;
import com.codeheadsystems.tether.server.state.OAuthStateRegistry;
import com.codeheadsystems.tether.server.store.ConnectionStore;
import com.codeheadsystems.tether.server.store.ProviderConnection;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the connection endpoints: CSRF state registration, code
 * exchange, listing and disconnecting.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}     bad or missing request data, HTTP 400</li>
 *   <li>{@link SecurityException}            unknown, expired or foreign state, HTTP 401</li>
 *   <li>{@link ConnectionNotFoundException}  nothing to disconnect, HTTP 404</li>
 *   <li>{@link ProviderTokenException}       the provider refused or failed, HTTP 502</li>
 * </ul>
 */
public class ConnectionManager {

  /** Shortest PKCE verifier (RFC 7636 §4.1). */
  public static final int MIN_VERIFIER_LENGTH = 43;
  /** Longest PKCE verifier (RFC 7636 §4.1). */
  public static final int MAX_VERIFIER_LENGTH = 128;

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final ConnectionStore connectionStore;
  private final OAuthStateRegistry stateRegistry;
  private final TokenCipher tokenCipher;
  private final ProviderTokenAccessor providerTokenAccessor;
  private final Map<Provider, ProviderSettings> providers;
  private final String defaultRedirectUri;
  private final Clock clock;

  /**
   * Instantiates a new Connection manager.
   *
   * @param connectionStore       the connection store
   * @param stateRegistry         the state registry
   * @param tokenCipher           the token cipher
   * @param providerTokenAccessor the provider token accessor
   * @param providers             settings for each configured provider
   * @param defaultRedirectUri    redirect uri used when a callback request does not name one
   * @param clock                 the clock
   */
  public ConnectionManager(ConnectionStore connectionStore,
                           OAuthStateRegistry stateRegistry,
                           TokenCipher tokenCipher,
                           ProviderTokenAccessor providerTokenAccessor,
                           Map<Provider, ProviderSettings> providers,
                           String defaultRedirectUri,
                           Clock clock) {
    log.info("ConnectionManager(providers={}, defaultRedirectUri={})", providers.keySet(), defaultRedirectUri);
    this.connectionStore = connectionStore;
    this.stateRegistry = stateRegistry;
    this.tokenCipher = tokenCipher;
    this.providerTokenAccessor = providerTokenAccessor;
    this.providers = providers.isEmpty() ? Map.of() : new EnumMap<>(providers);
    this.defaultRedirectUri = defaultRedirectUri;
    this.clock = clock;
  }

  // ── State ─────────────────────────────────────────────────────────────────

  /**
   * Binds a CSRF state to the user ahead of the authorization redirect.
   *
   * @param userId  the user id
   * @param request the request
   */
  public void registerState(String userId, RegisterStateRequest request) {
    log.debug("registerState(userId={})", userId);
    if (request == null || request.provider() == null) {
      throw new IllegalArgumentException("Missing required field: provider");
    }
    settingsFor(request.provider());
    stateRegistry.register(userId, request.provider(), request.state());
  }

  // ── Callback ──────────────────────────────────────────────────────────────

  /**
   * Completes a connection: consumes the state, exchanges the code at the provider and stores
   * the encrypted tokens as a fresh ACTIVE connection, replacing any previous one.
   *
   * @param userId  the user id
   * @param request the request
   * @return the callback response
   */
  public CallbackResponse callback(String userId, CallbackRequest request) {
    if (request == null || request.provider() == null) {
      throw new IllegalArgumentException("Missing required field: provider");
    }
    Provider provider = request.provider();
    log.debug("callback(userId={}, provider={})", userId, provider);
    requireText(request.code(), "code");
    requireText(request.state(), "state");
    String verifier = request.codeVerifier();
    if (verifier == null || verifier.length() < MIN_VERIFIER_LENGTH || verifier.length() > MAX_VERIFIER_LENGTH) {
      throw new IllegalArgumentException("codeVerifier must be " + MIN_VERIFIER_LENGTH + " to "
          + MAX_VERIFIER_LENGTH + " characters");
    }
    ProviderSettings settings = settingsFor(provider);
    String redirectUri = request.redirectUri() == null || request.redirectUri().isBlank()
        ? defaultRedirectUri
        : request.redirectUri();

    stateRegistry.consume(userId, provider, request.state());

    TokenResponse tokens = providerTokenAccessor.exchangeCode(settings, request.code(), verifier, redirectUri);
    if (tokens.refreshToken() == null || tokens.refreshToken().isEmpty()) {
      throw new ProviderTokenException(provider + " did not issue a refresh token", 200, null, null);
    }
    if (!tokens.hasUsableLifetime()) {
      throw new ProviderTokenException(provider + " returned an unusable token lifetime: "
          + tokens.expiresIn(), 200, null, null);
    }
    String providerUserId = fetchProviderUserId(settings, tokens.accessToken());

    Instant now = clock.instant();
    ProviderConnection connection = new ProviderConnection(
        UUID.randomUUID().toString(),
        userId,
        provider.name(),
        providerUserId,
        tokenCipher.encrypt(tokens.accessToken()),
        tokenCipher.encrypt(tokens.refreshToken()),
        now.plusSeconds(tokens.expiresInSeconds()),
        tokens.scope(),
        now,
        null,
        ConnectionStatus.ACTIVE);
    connectionStore.replace(connection);
    log.info("Connected user {} to {} as connection {}", userId, provider, connection.id());
    return new CallbackResponse(true, provider);
  }

  // ── Listing ───────────────────────────────────────────────────────────────

  /**
   * The user's connections. Never includes tokens.
   *
   * @param userId the user id
   * @return the connections response
   */
  public ConnectionsResponse list(String userId) {
    log.debug("list(userId={})", userId);
    List<ConnectionSummary> summaries = connectionStore.listByUser(userId).stream()
        .map(ProviderConnection::summary)
        .flatMap(Optional::stream)
        .toList();
    return new ConnectionsResponse(summaries);
  }

  // ── Disconnect ────────────────────────────────────────────────────────────

  /**
   * Revokes the grant at the provider where possible, then deletes the connection.
   *
   * @param userId   the user id
   * @param provider the provider
   */
  public void disconnect(String userId, Provider provider) {
    log.debug("disconnect(userId={}, provider={})", userId, provider);
    if (provider == null) {
      throw new IllegalArgumentException("Missing required field: provider");
    }
    ProviderConnection connection = connectionStore.findByUserAndProvider(userId, provider)
        .orElseThrow(() -> new ConnectionNotFoundException("No " + provider + " connection"));
    ProviderSettings settings = providers.get(provider);
    if (settings != null) {
      try {
        providerTokenAccessor.revoke(settings, tokenCipher.decrypt(connection.refreshToken()));
      } catch (ProviderTokenException | TokenCipherException e) {
        log.warn("Could not revoke {} grant for connection {}: {}", provider, connection.id(), e.getMessage());
      }
    }
    connectionStore.delete(connection.id());
    log.info("Disconnected user {} from {}", userId, provider);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private ProviderSettings settingsFor(Provider provider) {
    ProviderSettings settings = providers.get(provider);
    if (settings == null) {
      throw new IllegalArgumentException("Provider not configured: " + provider);
    }
    return settings;
  }

  private String fetchProviderUserId(ProviderSettings settings, String accessToken) {
    try {
      return providerTokenAccessor.fetchProviderUserId(settings, accessToken).orElse(null);
    } catch (ProviderTokenException e) {
      log.warn("Could not fetch {} user id: {}", settings.provider(), e.getMessage());
      return null;
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
  }
}
