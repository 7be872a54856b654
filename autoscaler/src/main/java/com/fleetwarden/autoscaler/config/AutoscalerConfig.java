package com.fleetwarden.autoscaler.config;

import com.fleetwarden.core.retry.CloudRetryStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the audit, flag and report services, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class AutoscalerConfig {

    String redisUrl;

    // SCAN page size hint for audit reads
    int redisScanCount;

    // Retention
    Duration auditTtl;
    Duration shutdownTtl;
    Duration statsTtl;
    Duration scaleDownProtectedTtl;

    // Retry policy for cloud inventory calls made while building reports
    int reportRetryMaxAttempts;
    Duration reportRetryBaseDelay;
    Duration reportRetryMaxDelay;
    Duration reportRetryMaxJitter;

    public static AutoscalerConfig fromEnv() {
        return AutoscalerConfig.builder()
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .redisScanCount(Integer.parseInt(getEnv("REDIS_SCAN_COUNT", "100")))
            .auditTtl(Duration.ofSeconds(Long.parseLong(getEnv("AUDIT_TTL_SEC", "172800"))))
            .shutdownTtl(Duration.ofSeconds(Long.parseLong(getEnv("SHUTDOWN_TTL_SEC", "900"))))
            .statsTtl(Duration.ofSeconds(Long.parseLong(getEnv("STATS_TTL_SEC", "900"))))
            .scaleDownProtectedTtl(Duration.ofSeconds(Long.parseLong(getEnv("SCALE_DOWN_PROTECTED_TTL_SEC", "900"))))
            .reportRetryMaxAttempts(Integer.parseInt(getEnv("REPORT_RETRY_MAX_ATTEMPTS", "3")))
            .reportRetryBaseDelay(Duration.ofMillis(Long.parseLong(getEnv("REPORT_RETRY_BASE_MS", "500"))))
            .reportRetryMaxDelay(Duration.ofMillis(Long.parseLong(getEnv("REPORT_RETRY_MAX_MS", "5000"))))
            .reportRetryMaxJitter(Duration.ofMillis(Long.parseLong(getEnv("REPORT_RETRY_JITTER_MS", "250"))))
            .build();
    }

    public CloudRetryStrategy reportRetryStrategy() {
        return CloudRetryStrategy.builder()
            .maxAttempts(reportRetryMaxAttempts)
            .baseDelay(reportRetryBaseDelay)
            .maxDelay(reportRetryMaxDelay)
            .maxJitter(reportRetryMaxJitter)
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
