package com.codeheadsystems.tether.server.refresh;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import com.codeheadsystems.tether.server.crypto.TokenCipher;
import com.codeheadsystems.tether.server.crypto.TokenCipherException;
import com.codeheadsystems.tether.server.lease.Lease;
import com.codeheadsystems.tether.server.lease.LeaseManager;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import com.codeheadsystems.tether.server.provider.ProviderTokenAccessor;
import com.codeheadsystems.tether.server.provider.ProviderTokenException;
import com.codeheadsystems.tether.server.provider.TokenResponse;
import com.codeheadsystems.tether.server.store.ConnectionStore;
import com.codeheadsystems.tether.server.store.ProviderConnection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out usable provider access tokens, refreshing them when they are about to expire.
 * <p>
 * Callers share nothing but the connection store and the lease store. A token that is still
 * outside the refresh buffer is decrypted and returned without touching either. Otherwise
 * one caller per connection takes the lease {@code token:refresh:<id>} and performs the
 * refresh; the others wait once, re-read the row, and either use the refreshed token or
 * report {@link RefreshErrorCode#REFRESH_IN_PROGRESS}. The lease is released on every path.
 */
public class TokenRefreshManager {

  /** Prefix of the per-connection refresh lease key. */
  public static final String LEASE_PREFIX = "token:refresh:";

  private static final Logger log = LoggerFactory.getLogger(TokenRefreshManager.class);

  private final ConnectionStore connectionStore;
  private final LeaseManager leaseManager;
  private final TokenCipher tokenCipher;
  private final ProviderTokenAccessor providerTokenAccessor;
  private final RefreshErrorClassifier refreshErrorClassifier;
  private final Map<Provider, ProviderSettings> providers;
  private final RefreshSettings settings;
  private final Clock clock;
  private final Sleeper sleeper;

  /**
   * Instantiates a new Token refresh manager.
   *
   * @param connectionStore        the connection store
   * @param leaseManager           the lease manager
   * @param tokenCipher            the token cipher
   * @param providerTokenAccessor  the provider token accessor
   * @param refreshErrorClassifier the refresh error classifier
   * @param providers              settings for each configured provider
   * @param settings               the timing settings
   * @param clock                  the clock
   * @param sleeper                the sleeper used by callers that lose the lease
   */
  public TokenRefreshManager(final ConnectionStore connectionStore,
                             final LeaseManager leaseManager,
                             final TokenCipher tokenCipher,
                             final ProviderTokenAccessor providerTokenAccessor,
                             final RefreshErrorClassifier refreshErrorClassifier,
                             final Map<Provider, ProviderSettings> providers,
                             final RefreshSettings settings,
                             final Clock clock,
                             final Sleeper sleeper) {
    log.info("TokenRefreshManager(providers={}, settings={})", providers.keySet(), settings);
    if (providerTokenAccessor.requestTimeout().compareTo(settings.leaseTtl()) >= 0) {
      throw new IllegalArgumentException("Provider request timeout " + providerTokenAccessor.requestTimeout()
          + " must be shorter than the lease TTL " + settings.leaseTtl());
    }
    this.connectionStore = connectionStore;
    this.leaseManager = leaseManager;
    this.tokenCipher = tokenCipher;
    this.providerTokenAccessor = providerTokenAccessor;
    this.refreshErrorClassifier = refreshErrorClassifier;
    this.providers = providers.isEmpty() ? Map.of() : new EnumMap<>(providers);
    this.settings = settings;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Returns a plaintext access token for the connection that is good for at least the
   * refresh buffer, refreshing it first if needed.
   *
   * @param connection the connection as last read by the caller
   * @return the access token
   * @throws TokenRefreshException on any failure, see {@link RefreshErrorCode}
   */
  public String getValidAccessToken(final ProviderConnection connection) {
    log.debug("getValidAccessToken(id={}, provider={})", connection.id(), connection.provider());
    if (isValid(connection, clock.instant())) {
      return decryptAccessToken(connection);
    }
    final ProviderSettings providerSettings = settingsFor(connection);
    requireRefreshable(connection);

    final Optional<Lease> lease = leaseManager.acquire(leaseKey(connection.id()), settings.leaseTtl());
    if (lease.isEmpty()) {
      return awaitOtherRefresh(connection.id());
    }
    try {
      return refreshUnderLease(connection.id(), providerSettings);
    } finally {
      leaseManager.release(lease.get());
    }
  }

  /**
   * Marks the connection EXPIRED, for subsystems that observe a dead token some other way.
   *
   * @param connection the connection
   * @return false if the connection no longer exists
   */
  public boolean markExpired(final ProviderConnection connection) {
    log.info("markExpired(id={}, provider={})", connection.id(), connection.provider());
    return connectionStore.markStatus(connection.id(), ConnectionStatus.EXPIRED);
  }

  /**
   * Whether the connection's access token can be used without refreshing.
   *
   * @param connection the connection
   * @param now        the current time
   * @return true if it expires no sooner than the buffer from now
   */
  public boolean isValid(final ProviderConnection connection, final Instant now) {
    return Duration.between(now, connection.tokenExpiresAt()).compareTo(settings.buffer()) >= 0;
  }

  /**
   * The lease key for a connection.
   *
   * @param connectionId the connection id
   * @return the key
   */
  public static String leaseKey(final String connectionId) {
    return LEASE_PREFIX + connectionId;
  }

  // ── Lease holder ──────────────────────────────────────────────────────────

  private String refreshUnderLease(final String connectionId, final ProviderSettings providerSettings) {
    // The row may have moved while we were acquiring.
    final ProviderConnection current = connectionStore.findById(connectionId)
        .orElseThrow(() -> notFound(connectionId));
    if (isValid(current, clock.instant())) {
      log.debug("refreshUnderLease(id={}) already refreshed by another holder", connectionId);
      return decryptAccessToken(current);
    }
    requireRefreshable(current);

    final String refreshToken = decrypt(current.refreshToken(), connectionId);
    final TokenResponse tokens;
    try {
      tokens = providerTokenAccessor.refresh(providerSettings, refreshToken);
    } catch (ProviderTokenException e) {
      throw classifyFailure(current, e);
    }
    if (!tokens.hasUsableLifetime()) {
      log.warn("Refresh of {} returned unusable expires_in={}", connectionId, tokens.expiresIn());
      throw new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED,
          current.provider() + " returned an unusable token lifetime: " + tokens.expiresIn());
    }

    final Instant refreshedAt = clock.instant();
    final Instant expiresAt = refreshedAt.plusSeconds(tokens.expiresInSeconds());
    final EncryptedToken accessToken;
    final EncryptedToken rotatedRefreshToken;
    try {
      accessToken = tokenCipher.encrypt(tokens.accessToken());
      rotatedRefreshToken = tokens.refreshToken() == null || tokens.refreshToken().isEmpty()
          ? null
          : tokenCipher.encrypt(tokens.refreshToken());
    } catch (TokenCipherException e) {
      throw new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED,
          "Could not encrypt refreshed tokens for " + connectionId, e);
    }
    if (!connectionStore.recordRefresh(connectionId, accessToken, expiresAt, refreshedAt, rotatedRefreshToken)) {
      throw notFound(connectionId);
    }
    log.info("Refreshed connection {} ({}), expires {}, rotated={}",
        connectionId, current.provider(), expiresAt, rotatedRefreshToken != null);
    return tokens.accessToken();
  }

  private TokenRefreshException classifyFailure(final ProviderConnection connection,
                                                final ProviderTokenException e) {
    if (e.statusCode() == 0) {
      log.warn("Refresh of {} got no response: {}", connection.id(), e.getMessage());
      return new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED,
          "No response from " + connection.provider() + " token endpoint", e);
    }
    final RefreshError error = refreshErrorClassifier.classify(e.statusCode(), e.body());
    if (error.permanent()) {
      log.warn("Refresh of {} failed permanently (status={}, error={}), marking EXPIRED",
          connection.id(), e.statusCode(), error.code());
      connectionStore.markStatus(connection.id(), ConnectionStatus.EXPIRED);
      return new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED_PERMANENT,
          connection.provider() + " rejected the refresh token: " + error.code(), e);
    }
    log.warn("Refresh of {} failed transiently (status={}, error={})",
        connection.id(), e.statusCode(), error.code());
    return new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED,
        connection.provider() + " token endpoint returned " + e.statusCode(), e);
  }

  // ── Lease loser ───────────────────────────────────────────────────────────

  private String awaitOtherRefresh(final String connectionId) {
    log.debug("awaitOtherRefresh(id={}, wait={})", connectionId, settings.lockWait());
    try {
      sleeper.sleep(settings.lockWait());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TokenRefreshException(RefreshErrorCode.REFRESH_IN_PROGRESS,
          "Interrupted waiting for refresh of " + connectionId, e);
    }
    final ProviderConnection reread = connectionStore.findById(connectionId)
        .orElseThrow(() -> notFound(connectionId));
    if (reread.status() == ConnectionStatus.ACTIVE && reread.tokenExpiresAt().isAfter(clock.instant())) {
      return decryptAccessToken(reread);
    }
    requireRefreshable(reread);
    throw new TokenRefreshException(RefreshErrorCode.REFRESH_IN_PROGRESS,
        "Connection " + connectionId + " is being refreshed elsewhere");
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private ProviderSettings settingsFor(final ProviderConnection connection) {
    final Provider provider = connection.knownProvider()
        .orElseThrow(() -> new TokenRefreshException(RefreshErrorCode.INVALID_PROVIDER,
            "Unknown provider: " + connection.provider()));
    final ProviderSettings providerSettings = providers.get(provider);
    if (providerSettings == null) {
      throw new TokenRefreshException(RefreshErrorCode.INVALID_PROVIDER,
          "Provider not configured: " + provider);
    }
    return providerSettings;
  }

  private void requireRefreshable(final ProviderConnection connection) {
    if (connection.status() != ConnectionStatus.ACTIVE) {
      throw new TokenRefreshException(RefreshErrorCode.REFRESH_FAILED_PERMANENT,
          "Connection " + connection.id() + " is " + connection.status() + "; re-authorization required");
    }
  }

  private String decryptAccessToken(final ProviderConnection connection) {
    return decrypt(connection.accessToken(), connection.id());
  }

  private String decrypt(final EncryptedToken token, final String connectionId) {
    try {
      return tokenCipher.decrypt(token);
    } catch (TokenCipherException e) {
      log.error("Stored token for connection {} cannot be decrypted ({})", connectionId, e.code());
      throw new TokenRefreshException(RefreshErrorCode.DECRYPTION_FAILED,
          "Stored token for " + connectionId + " cannot be decrypted", e);
    }
  }

  private static TokenRefreshException notFound(final String connectionId) {
    return new TokenRefreshException(RefreshErrorCode.CONNECTION_NOT_FOUND,
        "Connection " + connectionId + " no longer exists");
  }
}
