package io.prospekt.serialization;

import io.prospekt.core.cache.CacheEntry;
import java.util.List;

/// On-disk layout of the report cache file.
///
/// @param version format version, currently {@value #CURRENT_VERSION}
/// @param entries live entries ordered by key
record CacheSnapshot(int version, List<CacheEntry> entries) {

    static final int CURRENT_VERSION = 1;

    CacheSnapshot {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    static CacheSnapshot of(List<CacheEntry> entries) {
        return new CacheSnapshot(CURRENT_VERSION, entries);
    }
}
