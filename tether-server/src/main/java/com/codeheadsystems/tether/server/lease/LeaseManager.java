package com.codeheadsystems.tether.server.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * Mutual exclusion across independent worker processes.
 * <p>
 * At most one holder per key at a time. A lease that is never released lapses after its
 * TTL, so a crashed holder blocks others for at most that long.
 */
public interface LeaseManager {

  /**
   * Tries to take the lease. Never blocks.
   *
   * @param key the key
   * @param ttl how long the lease lasts if not released
   * @return the lease, or empty if someone else holds it
   */
  Optional<Lease> acquire(String key, Duration ttl);

  /**
   * Gives the lease back. Has no effect on a lease that lapsed and was taken by someone else.
   *
   * @param lease the lease
   * @return true if the lease was still held and is now released
   */
  boolean release(Lease lease);
}
