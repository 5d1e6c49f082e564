package io.prospekt.core.cache;

import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// Process-local {@link ReportCache} with no durable backing.
///
/// Used in tests and when caching to disk is disabled.
///
/// @implNote Thread-safe. Guarded by a {@link ReentrantReadWriteLock}.
public final class InMemoryReportCache implements ReportCache {

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExpiryPolicy expiryPolicy;
    private final Clock clock;

    public InMemoryReportCache() {
        this(ExpiryPolicy.NEVER, Clock.systemUTC());
    }

    public InMemoryReportCache(ExpiryPolicy expiryPolicy, Clock clock) {
        this.expiryPolicy = Objects.requireNonNull(expiryPolicy, "expiryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<Report> lookup(Subject subject) {
        Objects.requireNonNull(subject, "subject must not be null");
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(subject.key());
            if (entry == null || expiryPolicy.isExpired(entry, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.report());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(Subject subject, Report report) {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(report, "report must not be null");
        lock.writeLock().lock();
        try {
            entries.put(subject.key(), new CacheEntry(subject.key(), report, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean invalidate(Subject subject) {
        Objects.requireNonNull(subject, "subject must not be null");
        lock.writeLock().lock();
        try {
            return entries.remove(subject.key()) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            return entries.values().stream()
                    .filter(entry -> !expiryPolicy.isExpired(entry, clock.instant()))
                    .sorted(Comparator.comparing(CacheEntry::key))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
