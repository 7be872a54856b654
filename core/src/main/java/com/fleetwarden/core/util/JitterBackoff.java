package com.fleetwarden.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for retried cloud inventory calls.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap, jitter excluded)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay
     */
    public static Duration next(long attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(attempt, 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }
}
