package com.codeheadsystems.tether.dropwizard.auth;

import java.security.Principal;

/**
 * An authenticated end user. The name is the user id the connection endpoints key on.
 *
 * @param userId the user id from the JWT subject
 * @param jti    JWT ID
 */
public record TetherPrincipal(String userId, String jti) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
