package com.codeheadsystems.tether.server.refresh;

/**
 * Why {@link TokenRefreshManager#getValidAccessToken} failed.
 */
public enum RefreshErrorCode {
  /** Another caller holds the refresh lease; retry later. */
  REFRESH_IN_PROGRESS,
  /** The provider call failed transiently; the stored credential is untouched. */
  REFRESH_FAILED,
  /** The refresh token is dead; the connection is EXPIRED and needs a new authorization. */
  REFRESH_FAILED_PERMANENT,
  /** The connection names a provider that is unknown or not configured. */
  INVALID_PROVIDER,
  /** A stored token could not be decrypted. */
  DECRYPTION_FAILED,
  /** The connection no longer exists. */
  CONNECTION_NOT_FOUND
}
