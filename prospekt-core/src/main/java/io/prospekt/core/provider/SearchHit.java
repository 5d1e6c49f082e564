package io.prospekt.core.provider;

import java.util.Objects;

/// One web search result.
///
/// @param title page title, not null
/// @param snippet short excerpt, never null
/// @param url page link, never null
public record SearchHit(String title, String snippet, String url) {

    public SearchHit {
        Objects.requireNonNull(title, "title must not be null");
        snippet = snippet != null ? snippet : "";
        url = url != null ? url : "";
    }
}
