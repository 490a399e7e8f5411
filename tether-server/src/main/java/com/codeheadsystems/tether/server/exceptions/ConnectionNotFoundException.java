package com.codeheadsystems.tether.server.exceptions;

/**
 * Thrown when a user has no connection to the requested provider.
 */
public class ConnectionNotFoundException extends RuntimeException {

  /**
   * Instantiates a new Connection not found exception.
   *
   * @param message the message
   */
  public ConnectionNotFoundException(String message) {
    super(message);
  }
}
