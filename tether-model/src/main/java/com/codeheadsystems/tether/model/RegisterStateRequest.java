package com.codeheadsystems.tether.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Binds a freshly generated CSRF state to the authenticated user before the browser
 * session is launched. The server later accepts a {@link CallbackRequest} only if it
 * carries a state registered by the same user.
 * <p>
 * Used by: {@code POST /connections/state}
 *
 * @param provider the provider the authorization is for
 * @param state    the state value, {@code "<PROVIDER>:<uuid>"}
 */
public record RegisterStateRequest(
    @JsonProperty("provider") Provider provider,
    @JsonProperty("state") String state) {
}
