package io.prospekt.core.cache;

import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import java.util.List;
import java.util.Optional;

/// Subject-keyed store of previously produced reports.
///
/// The only mutable state shared between concurrent runs. Implementations serialize
/// writes against each other and against reads so a reader never observes a
/// half-written entry.
///
/// ### Contracts
/// - **Invariant**: at most one entry per normalized subject; the last write wins
/// - **Postcondition**: {@link #lookup} never performs network calls
///
/// @implNote Implementations must be thread-safe.
///
/// @see InMemoryReportCache
public interface ReportCache {

    /// Returns the cached report for a subject.
    ///
    /// @param subject normalized subject, not null
    /// @return cached report, or empty if absent or expired
    Optional<Report> lookup(Subject subject);

    /// Stores a report, replacing any existing entry for the subject.
    ///
    /// @param subject normalized subject, not null
    /// @param report report to cache, not null
    /// @throws CacheIOException if a durable backing could not be written; the in-memory
    /// index is left unchanged in that case
    void insert(Subject subject, Report report);

    /// Removes the entry for a subject. Absence is not an error.
    ///
    /// @param subject normalized subject, not null
    /// @return true if an entry was removed
    /// @throws CacheIOException if a durable backing could not be written
    boolean invalidate(Subject subject);

    /// Returns all live entries ordered by key.
    ///
    /// @return snapshot of entries, never null
    List<CacheEntry> entries();

    /// Removes every entry.
    ///
    /// @throws CacheIOException if a durable backing could not be written
    void clear();
}
