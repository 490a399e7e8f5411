package com.codeheadsystems.tether.server.refresh;

/**
 * A classified refresh failure from a provider token endpoint.
 *
 * @param code        the OAuth {@code error} value, or null if the body had none
 * @param description the {@code error_description}, may be null
 * @param permanent   true when the refresh token itself is no longer usable
 */
public record RefreshError(String code, String description, boolean permanent) {
}
