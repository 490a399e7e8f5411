package com.codeheadsystems.tether.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class TetherApplication extends Application<TetherConfiguration> {

  private final TetherBundle<TetherConfiguration> bundle = new TetherBundle<>();

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new TetherApplication().run(args);
  }

  @Override
  public String getName() {
    return "tether-test";
  }

  @Override
  public void initialize(Bootstrap<TetherConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(TetherConfiguration configuration, Environment environment) {
    // Test-only endpoint that hands out a valid provider token, as a host feature would
    environment.jersey().register(new ProviderTokenResource(bundle.tokenRefreshManager(),
        bundle.connectionStore()));
  }

  /**
   * The bundle, for tests that need its managers.
   *
   * @return the bundle
   */
  public TetherBundle<TetherConfiguration> bundle() {
    return bundle;
  }
}
