package com.codeheadsystems.tether.server.lease;

import com.codeheadsystems.tether.server.kv.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LeaseManager} on a {@link KeyValueStore}: the lease is an entry whose value is the
 * holder's owner token and whose TTL is the lease TTL.
 */
public class KeyValueLeaseManager implements LeaseManager {

  private static final Logger log = LoggerFactory.getLogger(KeyValueLeaseManager.class);

  private final KeyValueStore store;
  private final Clock clock;

  /**
   * Instantiates a new Key value lease manager.
   *
   * @param store the store
   * @param clock the clock used to stamp lease expiry
   */
  public KeyValueLeaseManager(KeyValueStore store, Clock clock) {
    log.info("KeyValueLeaseManager()");
    this.store = store;
    this.clock = clock;
  }

  @Override
  public Optional<Lease> acquire(String key, Duration ttl) {
    String ownerToken = UUID.randomUUID().toString();
    if (!store.putIfAbsent(key, ownerToken, ttl)) {
      log.debug("acquire(key={}) held elsewhere", key);
      return Optional.empty();
    }
    log.debug("acquire(key={}) acquired", key);
    return Optional.of(new Lease(key, ownerToken, clock.instant().plus(ttl)));
  }

  @Override
  public boolean release(Lease lease) {
    boolean released = store.deleteIfEquals(lease.key(), lease.ownerToken());
    if (!released) {
      log.warn("Lease {} had already lapsed before release", lease.key());
    }
    return released;
  }
}
