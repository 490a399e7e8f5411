package com.codeheadsystems.tether.server.refresh;

/**
 * Thrown by the refresh orchestrator. The code tells the caller whether to retry, re-authorize
 * or give up.
 */
public class TokenRefreshException extends RuntimeException {

  private final RefreshErrorCode code;

  /**
   * Instantiates a new Token refresh exception.
   *
   * @param code    the code
   * @param message the message
   */
  public TokenRefreshException(RefreshErrorCode code, String message) {
    this(code, message, null);
  }

  /**
   * Instantiates a new Token refresh exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public TokenRefreshException(RefreshErrorCode code, String message, Throwable cause) {
    super(code + ": " + message, cause);
    this.code = code;
  }

  /**
   * Code refresh error code.
   *
   * @return the refresh error code
   */
  public RefreshErrorCode code() {
    return code;
  }

  /**
   * Whether retrying later might succeed.
   *
   * @return true for in-progress and transient failures
   */
  public boolean isRetryable() {
    return code == RefreshErrorCode.REFRESH_IN_PROGRESS || code == RefreshErrorCode.REFRESH_FAILED;
  }
}
