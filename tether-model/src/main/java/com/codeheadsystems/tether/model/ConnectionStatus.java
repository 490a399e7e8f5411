package com.codeheadsystems.tether.model;

/**
 * Lifecycle status of a provider connection.
 * <p>
 * {@link #EXPIRED} is only ever set after a refresh failure the provider reported as
 * permanent. Nothing flips it back; the user reconnects, which writes a new connection.
 */
public enum ConnectionStatus {
  ACTIVE,
  EXPIRED,
  REVOKED
}
