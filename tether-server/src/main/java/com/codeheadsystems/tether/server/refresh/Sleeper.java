package com.codeheadsystems.tether.server.refresh;

import java.time.Duration;

/**
 * Blocks the calling thread. Tests substitute one that coordinates with other threads.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleep for the duration.
   *
   * @param duration the duration
   * @throws InterruptedException if interrupted
   */
  void sleep(Duration duration) throws InterruptedException;

  /**
   * A sleeper backed by {@link Thread#sleep(long)}.
   *
   * @return the sleeper
   */
  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
