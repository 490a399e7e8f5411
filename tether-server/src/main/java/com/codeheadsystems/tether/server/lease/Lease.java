package com.codeheadsystems.tether.server.lease;

import java.time.Instant;

/**
 * Proof of holding a lease. Only the holder has the owner token, so only the holder can
 * release it.
 *
 * @param key        the leased key
 * @param ownerToken random token identifying this holder
 * @param expiresAt  when the lease lapses if never released
 */
public record Lease(String key, String ownerToken, Instant expiresAt) {
}
