package com.codeheadsystems.tether.dropwizard.auth;

import com.codeheadsystems.tether.server.auth.JwtManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates JWT bearer tokens using {@link JwtManager}.
 */
public class TetherAuthenticator implements Authenticator<String, TetherPrincipal> {

  private final JwtManager jwtManager;

  /**
   * Instantiates a new Tether authenticator.
   *
   * @param jwtManager the jwt manager
   */
  public TetherAuthenticator(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  public Optional<TetherPrincipal> authenticate(String token) throws AuthenticationException {
    return jwtManager.verify(token)
        .map(result -> new TetherPrincipal(result.subject(), result.jti()));
  }
}
