package com.codeheadsystems.tether.client.error;

/**
 * A classified authorization failure, ready for display.
 *
 * @param code        the category
 * @param message     a short message suitable for the user
 * @param recoverable whether retrying on the device can succeed
 * @param action      the suggested action
 */
public record OAuthError(OAuthErrorCode code, String message, boolean recoverable, RecoveryAction action) {
}
