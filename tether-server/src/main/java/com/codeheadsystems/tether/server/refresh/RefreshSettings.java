package com.codeheadsystems.tether.server.refresh;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing for the token refresh orchestrator.
 *
 * @param buffer         a token expiring sooner than this is refreshed
 * @param leaseTtl       how long a refresh lease lives if never released
 * @param lockWait       how long a caller that lost the lease waits before re-reading
 * @param requestTimeout timeout on each provider request, strictly below {@code leaseTtl}
 */
public record RefreshSettings(Duration buffer, Duration leaseTtl, Duration lockWait, Duration requestTimeout) {

  /** Default refresh buffer. */
  public static final Duration DEFAULT_BUFFER = Duration.ofMinutes(5);
  /** Default lease TTL. */
  public static final Duration DEFAULT_LEASE_TTL = Duration.ofSeconds(60);
  /** Default wait for a losing caller. */
  public static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(2);
  /** Default provider request timeout. */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);

  /**
   * Instantiates a new Refresh settings.
   */
  public RefreshSettings {
    requirePositive(buffer, "buffer");
    requirePositive(leaseTtl, "leaseTtl");
    requirePositive(lockWait, "lockWait");
    requirePositive(requestTimeout, "requestTimeout");
    if (requestTimeout.compareTo(leaseTtl) >= 0) {
      throw new IllegalArgumentException("requestTimeout " + requestTimeout
          + " must be shorter than leaseTtl " + leaseTtl);
    }
  }

  /**
   * Defaults refresh settings.
   *
   * @return the refresh settings
   */
  public static RefreshSettings defaults() {
    return new RefreshSettings(DEFAULT_BUFFER, DEFAULT_LEASE_TTL, DEFAULT_LOCK_WAIT, DEFAULT_REQUEST_TIMEOUT);
  }

  private static void requirePositive(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive: " + duration);
    }
  }
}
