package com.codeheadsystems.tether.client.error;

/**
 * User-facing categories of authorization failures.
 */
public enum OAuthErrorCode {
  USER_CANCELLED,
  USER_DENIED,
  STATE_MISMATCH,
  VERIFIER_NOT_FOUND,
  CONFIG_ERROR,
  NETWORK_ERROR,
  TOKEN_EXCHANGE_FAILED,
  PROVIDER_ERROR,
  INVALID_GRANT,
  INVALID_SCOPE,
  UNKNOWN
}
