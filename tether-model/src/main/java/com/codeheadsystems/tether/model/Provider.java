package com.codeheadsystems.tether.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The third-party content providers a user can connect.
 * <p>
 * The set is closed: every provider has hand-written endpoint and scope configuration on
 * both the client and the server. The enum name doubles as the prefix of the CSRF state
 * ({@code "SPOTIFY:<uuid>"}), which is how the deep-link dispatcher recovers the provider
 * from an inbound redirect.
 */
public enum Provider {

  /** Video provider (Google). */
  YOUTUBE,
  /** Audio provider. */
  SPOTIFY,
  /** Mail provider (Google). */
  GMAIL;

  /**
   * Looks up a provider by its exact enum name.
   *
   * @param name the name, may be null
   * @return the provider, or empty if the name is not a known provider
   */
  public static Optional<Provider> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(p -> p.name().equals(name))
        .findFirst();
  }

  /**
   * The prefix this provider puts in front of the random part of a CSRF state.
   *
   * @return the state prefix, including the trailing colon
   */
  public String statePrefix() {
    return name() + ":";
  }
}
