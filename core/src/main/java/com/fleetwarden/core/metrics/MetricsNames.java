package com.fleetwarden.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code fleet.<component>.<metric>}, counters end in {@code .total}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: audit events written.
     * <p>
     * Tags: type (wire name of the event)
     * </p>
     */
    public static final String AUDIT_WRITES_TOTAL = "fleet.audit.writes.total";

    /**
     * Counter: audit writes the store did not acknowledge.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String AUDIT_WRITE_FAILURES_TOTAL = "fleet.audit.write.failures.total";

    /**
     * Counter: group report generations.
     * <p>
     * Tags: result (success/failure)
     * </p>
     */
    public static final String REPORT_GENERATIONS_TOTAL = "fleet.report.generations.total";
}
