package io.prospekt.core.subject;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/// Normalized identity of one unit of work (a company).
///
/// The {@link #key()} is the cache key and the equality basis: trimmed, internal
/// whitespace collapsed to single spaces, lowercased with {@link Locale#ROOT}. The
/// {@link #displayName()} keeps the caller's casing for prompts, queries and file names.
///
/// ### Contracts
/// - **Invariant**: `normalize(normalize(x)).equals(normalize(x))`
/// - **Invariant**: inputs differing only in case or whitespace yield equal subjects
///
/// @param key normalized cache key, not blank
/// @param displayName whitespace-collapsed original input, not blank
public record Subject(String key, String displayName) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /// Re-normalizes `key`, so subjects rebuilt from stored data keep the key invariant.
    public Subject {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        key = normalize(key);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Subject must not be blank");
        }
    }

    /// Creates a subject from raw user input.
    ///
    /// @param rawName company name as typed, not null
    /// @return normalized subject, never null
    /// @throws IllegalArgumentException if the input is blank
    public static Subject of(String rawName) {
        Objects.requireNonNull(rawName, "rawName must not be null");
        String display = collapse(rawName);
        if (display.isEmpty()) {
            throw new IllegalArgumentException("Subject must not be blank");
        }
        return new Subject(display.toLowerCase(Locale.ROOT), display);
    }

    /// Returns the normalized key for a raw name without building a subject.
    ///
    /// @param rawName company name as typed, not null
    /// @return normalized key, possibly empty for blank input
    public static String normalize(String rawName) {
        Objects.requireNonNull(rawName, "rawName must not be null");
        return collapse(rawName).toLowerCase(Locale.ROOT);
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.strip()).replaceAll(" ");
    }

    /// Subjects are equal when their keys are; display casing is ignored.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subject other)) return false;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
