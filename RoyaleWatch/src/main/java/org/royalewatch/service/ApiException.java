package org.royalewatch.service;

import java.time.Duration;

/**
 * Failure of a call to the battle-log API, classified so the scheduler can decide how to back off.
 */
public class ApiException extends Exception {

    public enum Kind {
        NOT_FOUND,
        RATE_LIMITED,
        TRANSIENT
    }

    private final Kind kind;
    private final Duration retryAfter;

    public ApiException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ApiException(Kind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public Kind getKind() {
        return kind;
    }

    /** Server supplied delay before the next attempt, or null. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
