package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link ConnectionStore}. All connections are lost on restart.
 * Suitable for development and testing only.
 */
public class InMemoryConnectionStore implements ConnectionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionStore.class);

  private final Map<String, ProviderConnection> byId = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory connection store.
   */
  public InMemoryConnectionStore() {
    log.warn("InMemoryConnectionStore: connections are not persisted");
  }

  @Override
  public Optional<ProviderConnection> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<ProviderConnection> findByUserAndProvider(String userId, Provider provider) {
    return byId.values().stream()
        .filter(c -> c.userId().equals(userId) && c.provider().equals(provider.name()))
        .findFirst();
  }

  @Override
  public List<ProviderConnection> listByUser(String userId) {
    return byId.values().stream()
        .filter(c -> c.userId().equals(userId))
        .sorted(Comparator.comparing(ProviderConnection::provider))
        .toList();
  }

  @Override
  public synchronized void replace(ProviderConnection connection) {
    byId.values().removeIf(c -> c.userId().equals(connection.userId())
        && c.provider().equals(connection.provider()));
    byId.put(connection.id(), connection);
    log.debug("replace(id={}, provider={})", connection.id(), connection.provider());
  }

  @Override
  public boolean recordRefresh(String id, EncryptedToken accessToken, Instant tokenExpiresAt,
                               Instant refreshedAt, EncryptedToken rotatedRefreshToken) {
    return byId.computeIfPresent(id,
        (k, c) -> c.withRefresh(accessToken, tokenExpiresAt, refreshedAt, rotatedRefreshToken)) != null;
  }

  @Override
  public boolean markStatus(String id, ConnectionStatus status) {
    return byId.computeIfPresent(id, (k, c) -> c.withStatus(status)) != null;
  }

  @Override
  public boolean delete(String id) {
    return byId.remove(id) != null;
  }
}
