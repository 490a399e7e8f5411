package com.codeheadsystems.tether.server.exceptions;

/**
 * Thrown when the connection store's backing database fails.
 */
public class ConnectionStoreException extends RuntimeException {

  /**
   * Instantiates a new Connection store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConnectionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
