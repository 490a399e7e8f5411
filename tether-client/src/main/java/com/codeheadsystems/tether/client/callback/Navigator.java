package com.codeheadsystems.tether.client.callback;

import com.codeheadsystems.tether.client.manager.CompletionResult;

/**
 * Moves the user off the callback screen once a redirect has been handled.
 */
@FunctionalInterface
public interface Navigator {

  /**
   * Called exactly once per dispatched callback, on success and on failure.
   *
   * @param result the completion result
   */
  void leaveCallback(CompletionResult result);
}
