package com.codeheadsystems.tether.server.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store with per-entry time-to-live. Every worker process sees the same
 * entries, so it is the coordination point between them.
 * <p>
 * Implementations must be thread-safe, and {@link #putIfAbsent} and {@link #deleteIfEquals}
 * must be atomic with respect to every other caller of the same store.
 */
public interface KeyValueStore {

  /**
   * Writes an entry only if no live entry exists for the key.
   *
   * @param key   the key
   * @param value the value
   * @param ttl   time until the entry expires on its own
   * @return true if this call created the entry
   */
  boolean putIfAbsent(String key, String value, Duration ttl);

  /**
   * Reads a live entry.
   *
   * @param key the key
   * @return the value, or empty if missing or expired
   */
  Optional<String> get(String key);

  /**
   * Deletes the entry only if it currently holds {@code expected}.
   *
   * @param key      the key
   * @param expected the expected value
   * @return true if an entry was deleted
   */
  boolean deleteIfEquals(String key, String expected);

  /**
   * Deletes the entry unconditionally.
   *
   * @param key the key
   */
  void delete(String key);
}
