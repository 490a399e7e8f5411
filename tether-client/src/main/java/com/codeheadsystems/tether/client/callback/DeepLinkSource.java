package com.codeheadsystems.tether.client.callback;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Where inbound URLs come from: the URL that launched the app (cold start) and URLs
 * delivered while it runs (warm start). Platforms may report the same URL through both.
 */
public interface DeepLinkSource {

  /**
   * The URL that launched the app, if any.
   *
   * @return the initial url
   */
  Optional<String> initialUrl();

  /**
   * Registers a listener for URLs delivered while the app runs.
   *
   * @param listener the listener
   * @return a handle that removes the listener
   */
  Subscription subscribe(Consumer<String> listener);

  /**
   * Removes a listener.
   */
  interface Subscription extends AutoCloseable {

    @Override
    void close();
  }
}
