package io.prospekt.core.cache;

import java.io.Serial;

/// Thrown when the durable cache backing cannot be read or written.
///
/// Never fatal to a run: the orchestrator logs it and proceeds as a cache miss or
/// reports the failed write as a warning.
public class CacheIOException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2216190785539172530L;

    public CacheIOException(String message) {
        super(message);
    }

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
