package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link ProviderConnection}s. At most one connection per (user, provider).
 * <p>
 * Implementations must be thread-safe. Tokens arrive already encrypted.
 */
public interface ConnectionStore {

  /**
   * Find by id.
   *
   * @param id the id
   * @return the connection
   */
  Optional<ProviderConnection> findById(String id);

  /**
   * Find the user's connection to a provider.
   *
   * @param userId   the user id
   * @param provider the provider
   * @return the connection
   */
  Optional<ProviderConnection> findByUserAndProvider(String userId, Provider provider);

  /**
   * All of a user's connections.
   *
   * @param userId the user id
   * @return the connections
   */
  List<ProviderConnection> listByUser(String userId);

  /**
   * Stores a new connection, atomically removing any existing connection for the same user
   * and provider. Reconnecting always goes through here, never through a status change.
   *
   * @param connection the connection
   */
  void replace(ProviderConnection connection);

  /**
   * Records a successful refresh and marks the connection {@link ConnectionStatus#ACTIVE}.
   *
   * @param id                  the id
   * @param accessToken         the new access token
   * @param tokenExpiresAt      the new expiry
   * @param refreshedAt         when the refresh happened
   * @param rotatedRefreshToken the rotated refresh token, or null to keep the stored one
   * @return false if the connection no longer exists
   */
  boolean recordRefresh(String id, EncryptedToken accessToken, Instant tokenExpiresAt,
                        Instant refreshedAt, EncryptedToken rotatedRefreshToken);

  /**
   * Sets the status.
   *
   * @param id     the id
   * @param status the status
   * @return false if the connection no longer exists
   */
  boolean markStatus(String id, ConnectionStatus status);

  /**
   * Deletes a connection.
   *
   * @param id the id
   * @return false if it did not exist
   */
  boolean delete(String id);
}
