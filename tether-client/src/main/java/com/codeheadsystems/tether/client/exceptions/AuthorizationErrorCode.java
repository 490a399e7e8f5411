package com.codeheadsystems.tether.client.exceptions;

/**
 * Why a client-side authorization flow stopped.
 */
public enum AuthorizationErrorCode {
  /** The provider has no client id in this build. */
  CONFIG_ERROR,
  /** The server refused to register the CSRF state. */
  REGISTRATION_FAILED,
  /** The user cancelled or dismissed the browser session. */
  FLOW_CANCELLED,
  /** The provider redirected back with an {@code error} parameter. */
  PROVIDER_ERROR,
  /** The returned state does not match the stored state. */
  CSRF_MISMATCH,
  /** The redirect carried no authorization code. */
  MISSING_CODE,
  /** The redirect query could not be decoded. */
  MALFORMED_CALLBACK,
  /** The stored PKCE verifier is gone. */
  VERIFIER_NOT_FOUND,
  /** The state names a provider this client does not know. */
  UNKNOWN_PROVIDER,
  /** The server failed to exchange the code for tokens. */
  EXCHANGE_FAILED
}
