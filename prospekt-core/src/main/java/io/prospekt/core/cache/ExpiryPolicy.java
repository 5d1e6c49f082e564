package io.prospekt.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Decides whether a cache entry is still served by lookups.
///
/// Expired entries are treated as absent; they are dropped on the next write.
@FunctionalInterface
public interface ExpiryPolicy {

    /// Policy under which entries never expire.
    ExpiryPolicy NEVER = (entry, now) -> false;

    /// Returns whether the entry must no longer be served.
    ///
    /// @param entry cached entry, not null
    /// @param now current time, not null
    boolean isExpired(CacheEntry entry, Instant now);

    /// Creates a policy expiring entries older than `maxAge`.
    ///
    /// @param maxAge maximum entry age, positive
    /// @return age-based policy, never null
    static ExpiryPolicy maxAge(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
        return (entry, now) -> entry.createdAt().plus(maxAge).isBefore(now);
    }
}
