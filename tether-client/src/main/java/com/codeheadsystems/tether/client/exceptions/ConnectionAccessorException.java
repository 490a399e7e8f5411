package com.codeheadsystems.tether.client.exceptions;

/**
 * Thrown when a call to the tether server fails for reasons other than authentication.
 */
public class ConnectionAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * A failure before any HTTP status was received (I/O error, interruption).
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConnectionAccessorException(String message, Throwable cause) {
    this(message, 0, cause);
  }

  /**
   * Instantiates a new Connection accessor exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, or 0 if no response arrived
   * @param cause      the cause
   */
  public ConnectionAccessorException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * The HTTP status the server answered with.
   *
   * @return the status code, or 0 if the request never got a response
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * Whether the request failed without reaching the server.
   *
   * @return true for network failures
   */
  public boolean isNetworkFailure() {
    return statusCode == 0;
  }
}
