package com.fleetwarden.autoscaler.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetwarden.autoscaler.config.AutoscalerConfig;
import com.fleetwarden.autoscaler.redis.IKeyValueStore;
import com.fleetwarden.autoscaler.tracker.IJibriTracker;
import com.fleetwarden.core.model.InstanceDetails;
import com.fleetwarden.core.model.InstanceMetadata;
import com.fleetwarden.core.model.InstanceTypes;
import com.fleetwarden.core.model.JibriState;
import com.fleetwarden.core.model.JibriStatus;
import com.fleetwarden.core.model.StatsReport;
import com.fleetwarden.core.redis.Keys;
import com.fleetwarden.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Short-lived per-instance flags: "is shutting down", "is scale-down protected" and the last stats blob.
 * <p>
 * Every flag expires on its own. A missing key reads as {@code false}; an expired flag and one
 * that was never set are indistinguishable.
 * </p>
 */
public class ShutdownFlagStore implements IShutdownStatusProvider {
    private static final Logger log = LoggerFactory.getLogger(ShutdownFlagStore.class);

    private static final String PROTECTED = "true";

    private final IKeyValueStore store;
    private final IJibriTracker jibriTracker;
    private final long shutdownTtlSec;
    private final long statsTtlSec;
    private final long scaleDownProtectedTtlSec;

    public ShutdownFlagStore(IKeyValueStore store, IJibriTracker jibriTracker, AutoscalerConfig config) {
        this.store = store;
        this.jibriTracker = jibriTracker;
        this.shutdownTtlSec = config.getShutdownTtl().toSeconds();
        this.statsTtlSec = config.getStatsTtl().toSeconds();
        this.scaleDownProtectedTtlSec = config.getScaleDownProtectedTtl().toSeconds();
    }

    /**
     * Marks an instance as shutting down.
     */
    public Mono<Boolean> setShutdownStatus(InstanceDetails details) {
        return setShutdownStatus(details, Keys.SHUTDOWN_SENTINEL);
    }

    /**
     * Writes the shutdown flag with an arbitrary value; only {@link Keys#SHUTDOWN_SENTINEL} reads back as true.
     */
    public Mono<Boolean> setShutdownStatus(InstanceDetails details, String status) {
        String key = Keys.shutdown(details.getInstanceId());
        log.debug("Writing shutdown status: key={}, status={}", key, status);
        return store.setEx(key, status, shutdownTtlSec)
            .thenReturn(true);
    }

    public Mono<Boolean> getShutdownStatus(InstanceDetails details) {
        return getShutdownStatus(details.getInstanceId());
    }

    @Override
    public Mono<Boolean> getShutdownStatus(String instanceId) {
        String key = Keys.shutdown(instanceId);
        return store.get(key)
            .doOnNext(value -> log.debug("Read shutdown status: key={}, value={}", key, value))
            .map(Keys.SHUTDOWN_SENTINEL::equals)
            .defaultIfEmpty(false);
    }

    public Mono<Boolean> setScaleDownProtected(String instanceId) {
        return setScaleDownProtected(instanceId, scaleDownProtectedTtlSec);
    }

    /**
     * Protects an instance from scale-down for the given number of seconds.
     */
    public Mono<Boolean> setScaleDownProtected(String instanceId, long ttlSeconds) {
        String key = Keys.scaleDownProtected(instanceId);
        log.debug("Writing scale-down protection: key={}, ttl={}s", key, ttlSeconds);
        return store.setEx(key, PROTECTED, ttlSeconds)
            .thenReturn(true);
    }

    @Override
    public Mono<Boolean> isScaleDownProtected(String instanceId) {
        return store.get(Keys.scaleDownProtected(instanceId))
            .map(PROTECTED::equals)
            .defaultIfEmpty(false);
    }

    /**
     * Records a stats report.
     * <p>
     * Jibri reports go to the jibri tracker; any other type has its payload stored verbatim.
     * A jibri report whose status cannot be read fails the returned Mono.
     * </p>
     *
     * @return the tracker's result, or true once the blob is written
     */
    public Mono<Boolean> reportStats(StatsReport report) {
        InstanceDetails instance = report.getInstance();
        if (InstanceTypes.JIBRI.equals(instance.getInstanceType())) {
            return Mono.fromCallable(() -> toJibriState(report))
                .doOnNext(state -> log.debug("Tracking jibri state: {}", state))
                .flatMap(jibriTracker::track);
        }

        String key = Keys.stats(instance.getInstanceId());
        String payload = JsonUtils.writeValueAsString(report.getStats());
        log.debug("Writing instance stats: key={}, stats={}", key, payload);
        return store.setEx(key, payload, statsTtlSec)
            .thenReturn(true);
    }

    private static JibriState toJibriState(StatsReport report) {
        InstanceDetails instance = report.getInstance();
        JsonNode stats = report.getStats();
        JsonNode status = stats == null ? null : stats.get("status");
        return JibriState.builder()
            .jibriId(instance.getInstanceId())
            .status(status == null || status.isNull() ? null : JsonUtils.treeToValue(status, JibriStatus.class))
            .timestamp(report.getTimestamp())
            .metadata(InstanceMetadata.from(instance))
            .build();
    }
}
