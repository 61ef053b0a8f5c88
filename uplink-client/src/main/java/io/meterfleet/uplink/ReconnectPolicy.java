package io.meterfleet.uplink;

import java.time.Duration;

/**
 * Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code max}, for at most
 * {@code maxAttempts} attempts.
 */
public final class ReconnectPolicy {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_ATTEMPTS = 50;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is below base delay " + baseDelay);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param attempt 1-based attempt number
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        Duration delay = baseDelay;
        for (int i = 1; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay;
    }

    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public int getMaxAttempts() { return maxAttempts; }
}
