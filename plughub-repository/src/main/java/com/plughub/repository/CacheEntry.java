package com.plughub.repository;

import java.time.Instant;

/**
 * Cached value with optional expiry.
 *
 * @param value     cached value
 * @param expiresAt expiry instant; null = never
 */
record CacheEntry(Object value, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
