package com.herotasks.realtime.infrastructure;

import java.time.Duration;
import java.util.Optional;

/**
 * Linear back-off with a ceiling and a hard attempt limit:
 * {@code delay(n) = min(n * step, maxDelay)} for {@code 1 <= n <= maxAttempts},
 * no further retry after that.
 */
public class ReconnectPolicy {

    private final Duration step;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ReconnectPolicy(Duration step, Duration maxDelay, int maxAttempts) {
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        if (maxDelay.compareTo(step) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= step: " + maxDelay);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.step = step;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param failedAttempts consecutive failures so far, starting at 1
     * @return the wait before the next attempt, or empty once retries are exhausted
     */
    public Optional<Duration> delayFor(int failedAttempts) {
        if (failedAttempts < 1 || failedAttempts > maxAttempts) {
            return Optional.empty();
        }
        Duration linear = step.multipliedBy(failedAttempts);
        return Optional.of(linear.compareTo(maxDelay) > 0 ? maxDelay : linear);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
