package com.codeheadsystems.tether.client.store;

import com.codeheadsystems.tether.model.Provider;
import java.util.Optional;

/**
 * Device-local storage for the secrets of an in-flight authorization (PKCE verifier and
 * CSRF state). Platform secure storage plugs in behind this interface.
 * <p>
 * Implementations must be thread-safe.
 */
public interface EphemeralStore {

  /**
   * Reads an entry.
   *
   * @param key the key
   * @return the value, or empty if never written or already deleted
   */
  Optional<String> get(EphemeralKey key);

  /**
   * Writes an entry, replacing any previous value.
   *
   * @param key   the key
   * @param value the value
   */
  void set(EphemeralKey key, String value);

  /**
   * Deletes an entry. Deleting a missing entry is not an error.
   *
   * @param key the key
   */
  void delete(EphemeralKey key);

  /**
   * Deletes every entry held for the provider.
   *
   * @param provider the provider
   */
  default void deleteAll(Provider provider) {
    for (Purpose purpose : Purpose.values()) {
      delete(EphemeralKey.of(provider, purpose));
    }
  }
}
