package org.royalewatch.monitor;

import java.time.Duration;

/**
 * Exponential delay, capped, with the server's retry hint taking precedence.
 */
public record BackoffPolicy(Duration base, Duration max) {

    public Duration delayFor(int consecutiveFailures, Duration retryHint) {
        if (retryHint != null && !retryHint.isNegative() && !retryHint.isZero()) {
            return retryHint.compareTo(max) > 0 ? max : retryHint;
        }
        int exponent = Math.min(Math.max(consecutiveFailures - 1, 0), 30);
        long millis = base.toMillis() << exponent;
        if (millis <= 0 || millis > max.toMillis()) return max;
        return Duration.ofMillis(millis);
    }
}
