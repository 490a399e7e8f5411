package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.ConnectionSummary;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import java.time.Instant;
import java.util.Optional;

/**
 * A user's authorization to one provider, as persisted.
 * <p>
 * The provider is kept as the stored string rather than the enum: rows outlive code, and a
 * row naming a provider this build does not know must be readable so it can be reported.
 *
 * @param id              stable opaque identifier
 * @param userId          the owning user
 * @param provider        provider name as stored
 * @param providerUserId  the user's id at the provider, may be null
 * @param accessToken     encrypted access token
 * @param refreshToken    encrypted refresh token
 * @param tokenExpiresAt  when the access token expires
 * @param scopes          granted scopes as the provider reported them, may be null
 * @param connectedAt     when the user connected
 * @param lastRefreshedAt last successful refresh, null if never refreshed
 * @param status          lifecycle status
 */
public record ProviderConnection(String id,
                                 String userId,
                                 String provider,
                                 String providerUserId,
                                 EncryptedToken accessToken,
                                 EncryptedToken refreshToken,
                                 Instant tokenExpiresAt,
                                 String scopes,
                                 Instant connectedAt,
                                 Instant lastRefreshedAt,
                                 ConnectionStatus status) {

  /**
   * The provider as an enum.
   *
   * @return the provider, or empty if this build does not know it
   */
  public Optional<Provider> knownProvider() {
    return Provider.fromName(provider);
  }

  /**
   * Copy with a different status.
   *
   * @param newStatus the new status
   * @return the provider connection
   */
  public ProviderConnection withStatus(ConnectionStatus newStatus) {
    return new ProviderConnection(id, userId, provider, providerUserId, accessToken, refreshToken,
        tokenExpiresAt, scopes, connectedAt, lastRefreshedAt, newStatus);
  }

  /**
   * Copy reflecting a successful refresh. The connection becomes {@link ConnectionStatus#ACTIVE}.
   *
   * @param newAccessToken    the new access token
   * @param newExpiresAt      the new expiry
   * @param refreshedAt       when the refresh happened
   * @param rotatedRefreshToken the rotated refresh token, or null to keep the current one
   * @return the provider connection
   */
  public ProviderConnection withRefresh(EncryptedToken newAccessToken, Instant newExpiresAt,
                                        Instant refreshedAt, EncryptedToken rotatedRefreshToken) {
    return new ProviderConnection(id, userId, provider, providerUserId, newAccessToken,
        rotatedRefreshToken == null ? refreshToken : rotatedRefreshToken,
        newExpiresAt, scopes, connectedAt, refreshedAt, ConnectionStatus.ACTIVE);
  }

  /**
   * The user-visible view. Rows for unknown providers have no summary.
   *
   * @return the connection summary
   */
  public Optional<ConnectionSummary> summary() {
    return knownProvider().map(p -> new ConnectionSummary(p, status, providerUserId, scopes,
        connectedAt.toEpochMilli(), lastRefreshedAt == null ? null : lastRefreshedAt.toEpochMilli()));
  }
}
