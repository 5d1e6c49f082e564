package io.prospekt.core.cache;

import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import java.time.Instant;
import java.util.Objects;

/// A cached report for one normalized subject key.
///
/// @param key normalized subject key, not null
/// @param report cached report as originally returned, not null
/// @param createdAt when the entry was written, not null
public record CacheEntry(String key, Report report, Instant createdAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        key = Subject.normalize(key);
    }
}
