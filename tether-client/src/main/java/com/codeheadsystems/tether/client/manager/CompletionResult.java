package com.codeheadsystems.tether.client.manager;

import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.model.Provider;

/**
 * Outcome of completing an authorization from a deep link. Never thrown; failures are
 * values so the caller needs no exception handling.
 *
 * @param success       whether the provider is now connected
 * @param provider      the provider, null only when the callback named none
 * @param error         why it failed, null on success
 * @param providerError the provider's raw {@code error} parameter, if it sent one
 * @param message       a diagnostic message for logs, null on success
 */
public record CompletionResult(boolean success,
                               Provider provider,
                               AuthorizationErrorCode error,
                               String providerError,
                               String message) {

  /**
   * Success completion result.
   *
   * @param provider the provider
   * @return the completion result
   */
  public static CompletionResult success(Provider provider) {
    return new CompletionResult(true, provider, null, null, null);
  }

  /**
   * Failure completion result.
   *
   * @param provider the provider
   * @param error    the error
   * @param message  the message
   * @return the completion result
   */
  public static CompletionResult failure(Provider provider, AuthorizationErrorCode error, String message) {
    return new CompletionResult(false, provider, error, null, message);
  }

  /**
   * Failure reported by the provider itself.
   *
   * @param provider      the provider
   * @param providerError the provider error
   * @param message       the message
   * @return the completion result
   */
  public static CompletionResult providerFailure(Provider provider, String providerError, String message) {
    return new CompletionResult(false, provider, AuthorizationErrorCode.PROVIDER_ERROR, providerError, message);
  }
}
