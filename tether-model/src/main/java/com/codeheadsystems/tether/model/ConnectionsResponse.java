package com.codeheadsystems.tether.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code GET /connections}
 *
 * @param connections the caller's connections, one per provider
 */
public record ConnectionsResponse(
    @JsonProperty("connections") List<ConnectionSummary> connections) {
}
