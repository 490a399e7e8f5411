package com.codeheadsystems.tether.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a successful code exchange.
 *
 * @param success  always true; failures are reported as HTTP errors
 * @param provider the provider that is now connected
 */
public record CallbackResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("provider") Provider provider) {
}
