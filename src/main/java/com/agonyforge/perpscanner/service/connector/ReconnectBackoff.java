package com.agonyforge.perpscanner.service.connector;

import java.time.Duration;

/**
 * Exponential backoff for push reconnects: the delay doubles after every failure up to a cap, and retries stop
 * after a fixed number of attempts until the backoff is reset.
 */
public class ReconnectBackoff {
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    private int attempts = 0;
    private Duration currentDelay;

    public ReconnectBackoff(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive");
        }

        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay must not be less than base delay");
        }

        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.currentDelay = baseDelay;
    }

    public synchronized boolean shouldRetry() {
        return attempts < maxAttempts;
    }

    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Count a reconnect attempt and double the delay for the next one.
     */
    public synchronized void recordFailure() {
        attempts++;

        long doubled = currentDelay.toMillis() * 2;
        currentDelay = Duration.ofMillis(Math.min(doubled, maxDelay.toMillis()));
    }

    public synchronized void reset() {
        attempts = 0;
        currentDelay = baseDelay;
    }

    public synchronized int getAttempts() {
        return attempts;
    }
}
