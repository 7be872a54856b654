package com.fleetwarden.autoscaler.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetwarden.autoscaler.config.AutoscalerConfig;
import com.fleetwarden.autoscaler.redis.IKeyValueStore;
import com.fleetwarden.autoscaler.redis.ScanPage;
import com.fleetwarden.core.audit.AutoScalerActionItem;
import com.fleetwarden.core.audit.GroupEvent;
import com.fleetwarden.core.audit.GroupEventType;
import com.fleetwarden.core.audit.InstanceEvent;
import com.fleetwarden.core.audit.InstanceEventType;
import com.fleetwarden.core.audit.LauncherActionItem;
import com.fleetwarden.core.error.PersistenceException;
import com.fleetwarden.core.metrics.MetricsNames;
import com.fleetwarden.core.metrics.MetricsTags;
import com.fleetwarden.core.model.InstanceDetails;
import com.fleetwarden.core.model.InstanceState;
import com.fleetwarden.core.redis.Keys;
import com.fleetwarden.core.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Append/query store for timestamped lifecycle events.
 * <p>
 * Every write replaces the content and TTL of its key. Group run markers share one key per group,
 * action items get one key per timestamp so they accumulate until they expire.
 * </p>
 * <p>
 * Reads walk the whole SCAN cursor and fetch each page with one MGET. The result is a best-effort
 * snapshot: keys written or expired while the scan runs may or may not show up, and keys that expire
 * between SCAN and MGET are simply absent.
 * </p>
 */
public class AuditStore {
    private static final Logger log = LoggerFactory.getLogger(AuditStore.class);

    private final IKeyValueStore store;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final long auditTtlSec;
    private final int scanCount;

    public AuditStore(IKeyValueStore store, AutoscalerConfig config, MeterRegistry meterRegistry, Clock clock) {
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.auditTtlSec = config.getAuditTtl().toSeconds();
        this.scanCount = config.getRedisScanCount();
    }

    // ========== Instance events ==========

    public Mono<Boolean> saveLaunchEvent(String groupName, String instanceId) {
        InstanceEvent event = InstanceEvent.builder()
            .instanceId(instanceId)
            .type(InstanceEventType.LAUNCH_REQUESTED)
            .timestamp(clock.millis())
            .build();
        return setValue(instanceKey(groupName, instanceId, InstanceEventType.LAUNCH_REQUESTED), event,
            InstanceEventType.LAUNCH_REQUESTED.wireName());
    }

    /**
     * Writes a terminate request for each instance in one pipelined batch.
     * <p>
     * Keys are independent: if the batch fails midway some events may already be stored.
     * </p>
     */
    public Mono<Boolean> saveShutdownEvents(List<InstanceDetails> instances) {
        if (instances.isEmpty()) {
            return Mono.just(true);
        }
        String type = InstanceEventType.TERMINATE_REQUESTED.wireName();
        long now = clock.millis();
        Map<String, String> values = new LinkedHashMap<>();
        for (InstanceDetails instance : instances) {
            InstanceEvent event = InstanceEvent.builder()
                .instanceId(instance.getInstanceId())
                .type(InstanceEventType.TERMINATE_REQUESTED)
                .timestamp(now)
                .build();
            values.put(instanceKey(instance.getGroup(), instance.getInstanceId(), InstanceEventType.TERMINATE_REQUESTED),
                JsonUtils.writeValueAsString(event));
        }

        return store.setAllEx(values, auditTtlSec)
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException(String.join(",", values.keySet()), err))
            .flatMap(replies -> {
                List<String> keys = List.copyOf(values.keySet());
                if (replies.size() != keys.size()) {
                    return Mono.<Boolean>error(new PersistenceException(String.join(",", keys),
                        "expected " + keys.size() + " replies, got " + replies.size()));
                }
                for (int i = 0; i < replies.size(); i++) {
                    if (!IKeyValueStore.OK.equals(replies.get(i))) {
                        return Mono.<Boolean>error(new PersistenceException(keys.get(i), replies.get(i)));
                    }
                }
                return Mono.just(true);
            })
            .doOnSuccess(ok -> writeCounter(type).increment(instances.size()))
            .doOnError(err -> onWriteFailure(type, err));
    }

    /**
     * Stores the latest status report and keeps the launch/terminate markers of a live instance from expiring.
     */
    public Mono<Boolean> saveLatestStatus(String groupName, String instanceId, InstanceState state) {
        InstanceEvent event = InstanceEvent.builder()
            .instanceId(instanceId)
            .type(InstanceEventType.LATEST_STATUS)
            .timestamp(clock.millis())
            .state(state)
            .build();
        return setValue(instanceKey(groupName, instanceId, InstanceEventType.LATEST_STATUS), event,
            InstanceEventType.LATEST_STATUS.wireName())
            .flatMap(saved -> Mono.when(
                    attemptIgnoringFailure(refreshExpiration(groupName, instanceId, InstanceEventType.LAUNCH_REQUESTED)),
                    attemptIgnoringFailure(refreshExpiration(groupName, instanceId, InstanceEventType.TERMINATE_REQUESTED)))
                .thenReturn(saved));
    }

    private Mono<Boolean> refreshExpiration(String groupName, String instanceId, InstanceEventType type) {
        String key = instanceKey(groupName, instanceId, type);
        return store.expire(key, auditTtlSec)
            .doOnNext(refreshed -> {
                if (!refreshed) {
                    log.debug("No {} to refresh", key);
                }
            });
    }

    /**
     * Runs a write whose outcome does not matter: failures are logged and resolve to false.
     */
    static Mono<Boolean> attemptIgnoringFailure(Mono<Boolean> attempt) {
        return attempt
            .defaultIfEmpty(false)
            .onErrorResume(err -> {
                log.debug("Ignoring failed best-effort write: {}", err.toString());
                return Mono.just(false);
            });
    }

    // ========== Group events ==========

    public Mono<Boolean> updateLastLauncherRun(String groupName) {
        return updateRunMarker(groupName, GroupEventType.LAST_LAUNCHER_RUN);
    }

    public Mono<Boolean> updateLastAutoScalerRun(String groupName) {
        return updateRunMarker(groupName, GroupEventType.LAST_AUTOSCALER_RUN);
    }

    private Mono<Boolean> updateRunMarker(String groupName, GroupEventType type) {
        GroupEvent event = GroupEvent.builder()
            .groupName(groupName)
            .type(type)
            .timestamp(clock.millis())
            .build();
        return setValue(Keys.groupAudit(groupName, type.wireName()), event, type.wireName());
    }

    /**
     * Appends a launcher decision. An item without a timestamp is stamped with the current time.
     */
    public Mono<Boolean> saveLauncherActionItem(String groupName, LauncherActionItem item) {
        LauncherActionItem stamped = item.getTimestamp() > 0 ? item : item.withTimestamp(clock.millis());
        GroupEvent event = GroupEvent.builder()
            .groupName(groupName)
            .type(GroupEventType.LAUNCHER_ACTION_ITEM)
            .timestamp(stamped.getTimestamp())
            .launcherActionItem(stamped)
            .build();
        return setValue(actionItemKey(groupName, GroupEventType.LAUNCHER_ACTION_ITEM, stamped.getTimestamp()), event,
            GroupEventType.LAUNCHER_ACTION_ITEM.wireName());
    }

    /**
     * Appends an autoscaler decision. An item without a timestamp is stamped with the current time.
     */
    public Mono<Boolean> saveAutoScalerActionItem(String groupName, AutoScalerActionItem item) {
        AutoScalerActionItem stamped = item.getTimestamp() > 0 ? item : item.withTimestamp(clock.millis());
        GroupEvent event = GroupEvent.builder()
            .groupName(groupName)
            .type(GroupEventType.AUTOSCALER_ACTION_ITEM)
            .timestamp(stamped.getTimestamp())
            .autoScalerActionItem(stamped)
            .build();
        return setValue(actionItemKey(groupName, GroupEventType.AUTOSCALER_ACTION_ITEM, stamped.getTimestamp()), event,
            GroupEventType.AUTOSCALER_ACTION_ITEM.wireName());
    }

    // ========== Reads ==========

    /**
     * All instance events of a group, in no particular order.
     */
    public Mono<List<InstanceEvent>> getInstanceAudit(String groupName) {
        return scanValues(Keys.instanceAuditPattern(groupName))
            .concatMap(entry -> Mono.justOrEmpty(decodeInstanceEvent(entry.getKey(), entry.getValue())
                .filter(event -> belongsToGroup(groupName, entry.getKey(), event))))
            .collectList()
            .doOnNext(events -> log.debug("Instance audit for {}: {} events", groupName, events.size()));
    }

    /**
     * All group events of a group, in no particular order.
     */
    public Mono<List<GroupEvent>> getGroupAudit(String groupName) {
        return scanValues(Keys.groupAuditPattern(groupName))
            .concatMap(entry -> Mono.justOrEmpty(decodeGroupEvent(entry.getKey(), entry.getValue())))
            .filter(event -> groupName.equals(event.getGroupName()))
            .collectList()
            .doOnNext(events -> log.debug("Group audit for {}: {} events", groupName, events.size()));
    }

    private Flux<Map.Entry<String, String>> scanValues(String pattern) {
        return Flux.defer(() -> {
            // SCAN may return a key on more than one page
            Set<String> seen = new HashSet<>();
            return store.scan(ScanPage.INITIAL_CURSOR, pattern, scanCount)
                .expand(page -> page.isFinished()
                    ? Mono.empty()
                    : store.scan(page.cursor(), pattern, scanCount))
                .concatMap(page -> {
                    List<String> fresh = page.keys().stream()
                        .filter(seen::add)
                        .collect(Collectors.toList());
                    if (fresh.isEmpty()) {
                        return Flux.empty();
                    }
                    return store.getAll(fresh).flatMapIterable(Map::entrySet);
                });
        });
    }

    /**
     * The instance pattern of group {@code a} also matches keys of group {@code a:b}; only a key rebuilt
     * from the event itself proves the event belongs to the requested group.
     */
    private static boolean belongsToGroup(String groupName, String key, InstanceEvent event) {
        return event.getType() != null
            && key.equals(instanceKey(groupName, event.getInstanceId(), event.getType()));
    }

    private static Optional<InstanceEvent> decodeInstanceEvent(String key, String json) {
        return decode(key, json, type -> InstanceEventType.fromWireName(type).isPresent(), InstanceEvent.class);
    }

    private static Optional<GroupEvent> decodeGroupEvent(String key, String json) {
        return decode(key, json, type -> GroupEventType.fromWireName(type).isPresent(), GroupEvent.class);
    }

    /**
     * Decodes a record whose {@code type} tag belongs to the requested event family; records of the
     * other family share the key prefix and are skipped.
     */
    private static <T> Optional<T> decode(String key, String json, Predicate<String> acceptsType, Class<T> eventClass) {
        try {
            JsonNode node = JsonUtils.readTree(json);
            if (!acceptsType.test(node.path("type").asText())) {
                return Optional.empty();
            }
            return Optional.of(JsonUtils.treeToValue(node, eventClass));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping undecodable audit record {}", key, e);
            return Optional.empty();
        }
    }

    // ========== Writes ==========

    private Mono<Boolean> setValue(String key, Object value, String type) {
        return store.setEx(key, JsonUtils.writeValueAsString(value), auditTtlSec)
            .defaultIfEmpty("")
            .onErrorMap(err -> !(err instanceof PersistenceException), err -> new PersistenceException(key, err))
            .flatMap(reply -> IKeyValueStore.OK.equals(reply)
                ? Mono.just(true)
                : Mono.<Boolean>error(new PersistenceException(key, reply)))
            .doOnSuccess(ok -> writeCounter(type).increment())
            .doOnError(err -> onWriteFailure(type, err));
    }

    private void onWriteFailure(String type, Throwable err) {
        log.error("Failed to write {} audit event", type, err);
        Counter.builder(MetricsNames.AUDIT_WRITE_FAILURES_TOTAL)
            .tag(MetricsTags.TYPE, type)
            .register(meterRegistry)
            .increment();
    }

    private Counter writeCounter(String type) {
        return Counter.builder(MetricsNames.AUDIT_WRITES_TOTAL)
            .tag(MetricsTags.TYPE, type)
            .register(meterRegistry);
    }

    private static String instanceKey(String groupName, String instanceId, InstanceEventType type) {
        return Keys.instanceAudit(groupName, instanceId, type.wireName());
    }

    private static String actionItemKey(String groupName, GroupEventType type, long timestamp) {
        return Keys.groupAudit(groupName, type.wireName(), timestamp);
    }
}
