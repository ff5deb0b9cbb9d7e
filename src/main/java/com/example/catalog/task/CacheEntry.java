package com.example.catalog.task;

import java.time.Instant;

/**
 * A successfully computed task result.
 */
public record CacheEntry(Fingerprint fingerprint, Object value, Instant createdAt, Instant expiresAt) {
}
