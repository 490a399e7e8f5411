package com.codeheadsystems.tether.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a user may see about one of their connections. Never carries token material.
 *
 * @param provider          the provider
 * @param status            the connection status
 * @param providerUserId    the user's id at the provider, if known
 * @param scopes            the granted scopes as returned by the provider, may be null
 * @param connectedAtMillis epoch millis the connection was established
 * @param lastRefreshedAtMillis epoch millis of the last successful refresh, or null
 */
public record ConnectionSummary(
    @JsonProperty("provider") Provider provider,
    @JsonProperty("status") ConnectionStatus status,
    @JsonProperty("providerUserId") String providerUserId,
    @JsonProperty("scopes") String scopes,
    @JsonProperty("connectedAt") long connectedAtMillis,
    @JsonProperty("lastRefreshedAt") Long lastRefreshedAtMillis) {
}
