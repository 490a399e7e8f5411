package com.codeheadsystems.tether.client.store;

import com.codeheadsystems.tether.model.Provider;
import java.util.Objects;

/**
 * Key of an ephemeral entry. One entry per purpose per provider, so two providers can be
 * authorizing at the same time without clobbering each other.
 *
 * @param provider the provider
 * @param purpose  the purpose
 */
public record EphemeralKey(Provider provider, Purpose purpose) {

  /**
   * Instantiates a new Ephemeral key.
   *
   * @param provider the provider
   * @param purpose  the purpose
   */
  public EphemeralKey {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(purpose, "purpose");
  }

  /**
   * Convenience factory.
   *
   * @param provider the provider
   * @param purpose  the purpose
   * @return the key
   */
  public static EphemeralKey of(Provider provider, Purpose purpose) {
    return new EphemeralKey(provider, purpose);
  }
}
