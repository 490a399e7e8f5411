package com.codeheadsystems.tether.client.accessor;

import java.util.Optional;

/**
 * Supplies the signed-in user's bearer token for calls to the tether server.
 * Called once per request so implementations may refresh their session in between.
 */
@FunctionalInterface
public interface CredentialProvider {

  /**
   * The current bearer token, without the {@code Bearer } prefix.
   *
   * @return the token, or empty when no user is signed in
   */
  Optional<String> bearerToken();
}
