package com.codeheadsystems.tether.server.state;

import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.kv.KeyValueStore;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds an OAuth CSRF state to the user who started the flow, so a callback can only be
 * completed by that user and only once.
 * <p>
 * States are kept in the shared {@link KeyValueStore} under {@code oauth:state:<state>} with
 * the user id as the value. Consumption is an atomic compare-and-delete, so two concurrent
 * callbacks carrying the same state cannot both succeed.
 */
public class OAuthStateRegistry {

  /** How long a registered state stays usable. */
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
  /** Shortest accepted state. */
  public static final int MIN_STATE_LENGTH = 32;
  /** Longest accepted state. */
  public static final int MAX_STATE_LENGTH = 128;

  private static final Logger log = LoggerFactory.getLogger(OAuthStateRegistry.class);
  private static final String KEY_PREFIX = "oauth:state:";

  private final KeyValueStore store;
  private final Duration ttl;

  /**
   * Instantiates a new OAuth state registry with the default TTL.
   *
   * @param store the store
   */
  public OAuthStateRegistry(KeyValueStore store) {
    this(store, DEFAULT_TTL);
  }

  /**
   * Instantiates a new OAuth state registry.
   *
   * @param store the store
   * @param ttl   the state lifetime
   */
  public OAuthStateRegistry(KeyValueStore store, Duration ttl) {
    log.info("OAuthStateRegistry(ttl={})", ttl);
    this.store = store;
    this.ttl = ttl;
  }

  /**
   * Registers a state for a user.
   *
   * @param userId   the user id
   * @param provider the provider the flow is for
   * @param state    the state
   * @throws IllegalArgumentException if the state is malformed or already registered
   */
  public void register(String userId, Provider provider, String state) {
    log.debug("register(userId={}, provider={})", userId, provider);
    validate(provider, state);
    if (!store.putIfAbsent(key(state), userId, ttl)) {
      throw new IllegalArgumentException("State already registered");
    }
  }

  /**
   * Consumes a state. Succeeds at most once per registration.
   *
   * @param userId   the user completing the flow
   * @param provider the provider the callback claims
   * @param state    the state
   * @throws SecurityException if the state is unknown, expired, used, or belongs to someone else
   */
  public void consume(String userId, Provider provider, String state) {
    log.debug("consume(userId={}, provider={})", userId, provider);
    if (state == null || provider == null || !state.startsWith(provider.statePrefix())) {
      throw new SecurityException("State does not match provider");
    }
    if (!store.deleteIfEquals(key(state), userId)) {
      log.warn("Rejected OAuth state for user {} and provider {}", userId, provider);
      throw new SecurityException("Invalid or expired state");
    }
  }

  private static void validate(Provider provider, String state) {
    if (provider == null) {
      throw new IllegalArgumentException("provider is required");
    }
    if (state == null || state.length() < MIN_STATE_LENGTH || state.length() > MAX_STATE_LENGTH) {
      throw new IllegalArgumentException("state must be " + MIN_STATE_LENGTH + " to "
          + MAX_STATE_LENGTH + " characters");
    }
    if (!state.startsWith(provider.statePrefix())) {
      throw new IllegalArgumentException("state must start with " + provider.statePrefix());
    }
  }

  private static String key(String state) {
    return KEY_PREFIX + state;
  }
}
