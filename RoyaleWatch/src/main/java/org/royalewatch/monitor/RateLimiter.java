package org.royalewatch.monitor;

import java.time.Clock;
import java.util.concurrent.Semaphore;

/**
 * Shared outbound request budget: a token bucket plus a single fair permit, so requests leave one
 * at a time, in arrival order, never faster than the configured rate.
 */
public class RateLimiter {

    private final Semaphore gate = new Semaphore(1, true);
    private final Clock clock;
    private final double tokensPerMilli;
    private final double capacity;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefill;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public RateLimiter(double requestsPerSecond, int burst, Clock clock) {
        this(requestsPerSecond, burst, clock, Thread::sleep);
    }

    public RateLimiter(double requestsPerSecond, int burst, Clock clock, Sleeper sleeper) {
        if (requestsPerSecond <= 0) throw new IllegalArgumentException("requestsPerSecond must be positive");
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokensPerMilli = requestsPerSecond / 1000.0;
        this.capacity = Math.max(1, burst);
        this.tokens = capacity;
        this.lastRefill = clock.millis();
    }

    /**
     * Blocks until a request may be sent. The returned permit must be closed once the response is in.
     */
    public Permit acquire() throws InterruptedException {
        gate.acquire();
        try {
            long wait;
            while ((wait = takeToken()) > 0) {
                sleeper.sleep(wait);
            }
        } catch (InterruptedException | RuntimeException e) {
            gate.release();
            throw e;
        }
        return new Permit();
    }

    /** Returns 0 when a token was taken, otherwise the millis until one is available. */
    private synchronized long takeToken() {
        long now = clock.millis();
        tokens = Math.min(capacity, tokens + (now - lastRefill) * tokensPerMilli);
        lastRefill = now;
        if (tokens >= 1) {
            tokens -= 1;
            return 0;
        }
        return Math.max(1, (long) Math.ceil((1 - tokens) / tokensPerMilli));
    }

    public final class Permit implements AutoCloseable {
        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                gate.release();
            }
        }
    }
}
