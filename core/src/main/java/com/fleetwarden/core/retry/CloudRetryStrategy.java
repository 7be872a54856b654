package com.fleetwarden.core.retry;

import com.fleetwarden.core.util.JitterBackoff;
import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry policy for calls into the cloud provider.
 * <p>
 * Callers pass it through unchanged; only the cloud adapter applies it, via {@link #toRetry()}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CloudRetryStrategy {

    /**
     * Retries after the first failure; 0 disables retrying.
     */
    int maxAttempts;

    Duration baseDelay;
    Duration maxDelay;
    Duration maxJitter;

    public static CloudRetryStrategy none() {
        return CloudRetryStrategy.builder()
            .maxAttempts(0)
            .baseDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .maxJitter(Duration.ZERO)
            .build();
    }

    public Duration delayFor(long attempt) {
        return JitterBackoff.next(attempt, baseDelay, maxDelay, maxJitter);
    }

    /**
     * Reactor retry spec that waits {@link #delayFor(long)} between attempts and
     * rethrows the last failure once {@link #maxAttempts} is exhausted.
     */
    public Retry toRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            if (signal.totalRetries() >= maxAttempts) {
                return Mono.<Long>error(signal.failure());
            }
            return Mono.delay(delayFor(signal.totalRetries())).thenReturn(signal.totalRetries());
        }));
    }
}
