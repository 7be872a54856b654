package com.fleetwarden.autoscaler.config;

import com.fleetwarden.core.retry.CloudRetryStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AutoscalerConfigTest {

    @Test
    void testReportRetryStrategyFromConfig() {
        AutoscalerConfig config = AutoscalerConfig.builder()
            .reportRetryMaxAttempts(4)
            .reportRetryBaseDelay(Duration.ofMillis(100))
            .reportRetryMaxDelay(Duration.ofSeconds(2))
            .reportRetryMaxJitter(Duration.ZERO)
            .build();

        CloudRetryStrategy strategy = config.reportRetryStrategy();

        assertEquals(4, strategy.getMaxAttempts());
        assertEquals(Duration.ofMillis(400), strategy.delayFor(2));
        assertEquals(Duration.ofSeconds(2), strategy.delayFor(8));
    }

    @Test
    void testFromEnvFillsEveryField() {
        AutoscalerConfig config = AutoscalerConfig.fromEnv();

        assertNotNull(config.getRedisUrl());
        assertTrue(config.getRedisScanCount() > 0);
        assertNotNull(config.getAuditTtl());
        assertNotNull(config.getShutdownTtl());
        assertNotNull(config.getStatsTtl());
        assertNotNull(config.getScaleDownProtectedTtl());
        assertNotNull(config.reportRetryStrategy().getMaxDelay());
    }
}
