package io.prospekt.core.stage;

import java.util.Objects;

/// A recent news headline about the researched company.
///
/// @param headline article title, not null
/// @param summary snippet text, never null
/// @param url article link, never null
public record NewsItem(String headline, String summary, String url) {

    public NewsItem {
        Objects.requireNonNull(headline, "headline must not be null");
        summary = summary != null ? summary : "";
        url = url != null ? url : "";
    }
}
