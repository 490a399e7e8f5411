package com.codeheadsystems.tether.server.kv;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link KeyValueStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired entries are evicted lazily when touched. Only coordinates threads inside one JVM,
 * so it is suitable for a single server instance, development, and tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Instantiates a new In memory key value store on the system clock.
   */
  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory key value store.
   *
   * @param clock the clock that decides expiry
   */
  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    Instant now = clock.instant();
    AtomicBoolean created = new AtomicBoolean(false);
    entries.compute(key, (k, existing) -> {
      if (existing != null && !existing.isExpired(now)) {
        return existing;
      }
      created.set(true);
      return new Entry(value, now.plus(ttl));
    });
    log.debug("putIfAbsent(key={}) created={}", key, created.get());
    return created.get();
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public boolean deleteIfEquals(String key, String expected) {
    Instant now = clock.instant();
    AtomicBoolean deleted = new AtomicBoolean(false);
    entries.computeIfPresent(key, (k, existing) -> {
      if (existing.isExpired(now)) {
        return null;
      }
      if (existing.value().equals(expected)) {
        deleted.set(true);
        return null;
      }
      return existing;
    });
    return deleted.get();
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  private record Entry(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
