package com.codeheadsystems.tether.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks the server to exchange an authorization code for tokens.
 * <p>
 * The device never holds a client secret: it proves possession of the authorization
 * request by sending the PKCE verifier, and the server performs the exchange and stores
 * the resulting tokens encrypted.
 * <p>
 * Used by: {@code POST /connections/callback}
 *
 * @param provider     the provider that issued the code
 * @param code         the authorization code from the redirect
 * @param state        the state from the redirect; must have been registered by the caller
 * @param codeVerifier the PKCE verifier generated at the start of the flow
 * @param redirectUri  the redirect URI used in the authorization request, or null to use
 *                     the server's default
 */
public record CallbackRequest(
    @JsonProperty("provider") Provider provider,
    @JsonProperty("code") String code,
    @JsonProperty("state") String state,
    @JsonProperty("codeVerifier") String codeVerifier,
    @JsonProperty("redirectUri") String redirectUri) {
}
