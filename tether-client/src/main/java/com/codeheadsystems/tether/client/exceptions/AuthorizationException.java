package com.codeheadsystems.tether.client.exceptions;

/**
 * Thrown when a client-side authorization flow fails. By the time this reaches the caller
 * the flow's ephemeral entries have already been deleted.
 */
public class AuthorizationException extends RuntimeException {

  private final AuthorizationErrorCode code;
  private final String providerError;

  /**
   * Instantiates a new Authorization exception.
   *
   * @param code    the code
   * @param message the message
   */
  public AuthorizationException(AuthorizationErrorCode code, String message) {
    this(code, message, null, null);
  }

  /**
   * Instantiates a new Authorization exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public AuthorizationException(AuthorizationErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  /**
   * Instantiates a new Authorization exception.
   *
   * @param code          the code
   * @param message       the message
   * @param providerError the raw {@code error} parameter the provider sent, if any
   * @param cause         the cause
   */
  public AuthorizationException(AuthorizationErrorCode code, String message, String providerError,
                                Throwable cause) {
    super(message, cause);
    this.code = code;
    this.providerError = providerError;
  }

  /**
   * Code authorization error code.
   *
   * @return the authorization error code
   */
  public AuthorizationErrorCode code() {
    return code;
  }

  /**
   * The provider's raw error code, e.g. {@code access_denied}.
   *
   * @return the provider error, or null
   */
  public String providerError() {
    return providerError;
  }
}
