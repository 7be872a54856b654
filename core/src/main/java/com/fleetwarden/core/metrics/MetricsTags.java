package com.fleetwarden.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the audit event type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for an operation outcome (success/failure).
     */
    public static final String RESULT = "result";
}
