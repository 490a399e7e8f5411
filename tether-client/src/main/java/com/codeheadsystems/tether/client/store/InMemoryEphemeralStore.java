package com.codeheadsystems.tether.client.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EphemeralStore} kept in process memory. Entries vanish when the process exits,
 * which for an in-flight authorization is the same as the flow being abandoned.
 */
@Singleton
public class InMemoryEphemeralStore implements EphemeralStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEphemeralStore.class);

  private final ConcurrentHashMap<EphemeralKey, String> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(EphemeralKey key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void set(EphemeralKey key, String value) {
    if (entries.put(key, value) != null) {
      log.debug("Replaced stale entry {}", key);
    }
  }

  @Override
  public void delete(EphemeralKey key) {
    entries.remove(key);
  }

  /**
   * Number of live entries.
   *
   * @return the size
   */
  public int size() {
    return entries.size();
  }
}
