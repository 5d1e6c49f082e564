package io.prospekt.core.stage;

import java.util.Objects;

/// A decision maker at the researched company.
///
/// @param name full name, not null
/// @param title job title, not null
/// @param profileUrl public profile link, never null
/// @param bio short background, never null
/// @param email best-guess email address, never null
/// @param priorityScore ranking score, higher is contacted first
/// @param priorityReason human readable justification of the score, never null
public record Contact(
        String name,
        String title,
        String profileUrl,
        String bio,
        String email,
        int priorityScore,
        String priorityReason) {

    public Contact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(title, "title must not be null");
        profileUrl = profileUrl != null ? profileUrl : "";
        bio = bio != null ? bio : "";
        email = email != null ? email : "";
        priorityReason = priorityReason != null ? priorityReason : "";
    }

    /// Returns a copy carrying the given ranking.
    public Contact withPriority(int score, String reason) {
        return new Contact(name, title, profileUrl, bio, email, score, reason);
    }
}
