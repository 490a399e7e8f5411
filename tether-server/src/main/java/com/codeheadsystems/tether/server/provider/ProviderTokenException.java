package com.codeheadsystems.tether.server.provider;

/**
 * Thrown when a provider endpoint call fails.
 * <p>
 * A status of 0 means no HTTP response arrived (I/O failure, timeout, interruption).
 */
public class ProviderTokenException extends RuntimeException {

  private final int statusCode;
  private final String body;

  /**
   * Instantiates a new Provider token exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, 0 if none
   * @param body       the response body, may be null
   * @param cause      the cause
   */
  public ProviderTokenException(String message, int statusCode, String body, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.body = body;
  }

  /**
   * Status code int.
   *
   * @return the int
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * The raw response body.
   *
   * @return the body, may be null
   */
  public String body() {
    return body;
  }
}
