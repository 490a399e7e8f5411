package com.codeheadsystems.tether.client.browser;

import java.net.URI;

/**
 * Opens the provider's authorization page in a browser the app does not control and waits
 * until it is sent to the redirect URI or closed.
 */
public interface BrowserSession {

  /**
   * Runs the authorization session. Blocks until it finishes.
   *
   * @param authorizationUrl the provider URL to open
   * @param redirectUri      the URI that ends the session when the browser is sent to it
   * @return the result
   */
  BrowserResult authorize(URI authorizationUrl, String redirectUri);
}
