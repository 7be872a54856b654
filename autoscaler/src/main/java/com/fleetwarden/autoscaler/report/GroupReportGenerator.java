package com.fleetwarden.autoscaler.report;

import com.fleetwarden.autoscaler.cloud.ICloudManager;
import com.fleetwarden.autoscaler.group.IInstanceGroupManager;
import com.fleetwarden.autoscaler.status.IShutdownStatusProvider;
import com.fleetwarden.autoscaler.tracker.IInstanceTracker;
import com.fleetwarden.core.error.DependencyException;
import com.fleetwarden.core.error.FleetException;
import com.fleetwarden.core.error.GroupNotFoundException;
import com.fleetwarden.core.error.UnsupportedGroupTypeException;
import com.fleetwarden.core.metrics.MetricsNames;
import com.fleetwarden.core.metrics.MetricsTags;
import com.fleetwarden.core.model.CloudInstance;
import com.fleetwarden.core.model.InstanceGroup;
import com.fleetwarden.core.model.InstanceMetadata;
import com.fleetwarden.core.model.InstanceState;
import com.fleetwarden.core.model.InstanceStatus;
import com.fleetwarden.core.model.InstanceTypes;
import com.fleetwarden.core.model.JibriBusyStatus;
import com.fleetwarden.core.report.GroupReport;
import com.fleetwarden.core.report.InstanceReport;
import com.fleetwarden.core.retry.CloudRetryStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reconciles the tracked view of a group with the cloud provider's live view.
 * <p>
 * Steps:
 * <ol>
 *   <li>Resolve the group; it must exist and be typed</li>
 *   <li>Fetch tracked states and cloud instances concurrently</li>
 *   <li>Merge both views by instance id</li>
 *   <li>Annotate every instance with shutdown and scale-down protection flags, all lookups in parallel</li>
 *   <li>Fold the instances into group counters</li>
 * </ol>
 * Any collaborator failure fails the whole report; a partial report is never returned.
 * </p>
 */
public class GroupReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(GroupReportGenerator.class);

    private final IInstanceTracker instanceTracker;
    private final IInstanceGroupManager instanceGroupManager;
    private final ICloudManager cloudManager;
    private final IShutdownStatusProvider shutdownStatusProvider;
    private final CloudRetryStrategy reportRetryStrategy;

    private final Counter reportsGenerated;
    private final Counter reportsFailed;

    public GroupReportGenerator(IInstanceTracker instanceTracker,
                                IInstanceGroupManager instanceGroupManager,
                                ICloudManager cloudManager,
                                IShutdownStatusProvider shutdownStatusProvider,
                                CloudRetryStrategy reportRetryStrategy,
                                MeterRegistry meterRegistry) {
        this.instanceTracker = instanceTracker;
        this.instanceGroupManager = instanceGroupManager;
        this.cloudManager = cloudManager;
        this.shutdownStatusProvider = shutdownStatusProvider;
        this.reportRetryStrategy = reportRetryStrategy;

        reportsGenerated = Counter.builder(MetricsNames.REPORT_GENERATIONS_TOTAL)
            .tag(MetricsTags.RESULT, "success")
            .register(meterRegistry);

        reportsFailed = Counter.builder(MetricsNames.REPORT_GENERATIONS_TOTAL)
            .tag(MetricsTags.RESULT, "failure")
            .register(meterRegistry);
    }

    public Mono<GroupReport> generateReport(String groupName) {
        return instanceGroupManager.getInstanceGroup(groupName)
            .onErrorMap(dependencyFailure("group lookup for " + groupName))
            .switchIfEmpty(Mono.error(() -> new GroupNotFoundException(groupName)))
            .flatMap(group -> {
                if (!group.isTyped()) {
                    return Mono.error(new UnsupportedGroupTypeException(groupName));
                }
                return buildReport(group);
            })
            .doOnSuccess(report -> {
                reportsGenerated.increment();
                log.info("Generated report for {}: count={}, cloudCount={}, unTracked={}",
                    groupName, report.getCount(), report.getCloudCount(), report.getUnTrackedCount());
            })
            .doOnError(err -> {
                reportsFailed.increment();
                log.warn("Failed to generate report for {}: {}", groupName, err.getMessage());
            });
    }

    private Mono<GroupReport> buildReport(InstanceGroup group) {
        Mono<List<InstanceState>> tracked = instanceTracker.getCurrent(group.getName(), false)
            .onErrorMap(dependencyFailure("tracked instances of " + group.getName()));
        Mono<List<CloudInstance>> cloud = cloudManager.getInstances(group, reportRetryStrategy)
            .onErrorMap(dependencyFailure("cloud instances of " + group.getName()));

        return Mono.zip(tracked, cloud)
            .flatMap(views -> {
                List<InstanceState> states = views.getT1();
                List<CloudInstance> cloudInstances = views.getT2();
                log.debug("Merging {} tracked and {} cloud instances of {}",
                    states.size(), cloudInstances.size(), group.getName());
                List<InstanceReport> merged = new ArrayList<>(mergeViews(group, states, cloudInstances).values());
                return annotate(merged)
                    .map(instances -> fold(group, states.size(), instances));
            });
    }

    /**
     * Tracked entries come first, in tracker order; cloud-only entries follow in cloud order.
     */
    static Map<String, InstanceReport> mergeViews(InstanceGroup group,
                                                  List<InstanceState> states,
                                                  List<CloudInstance> cloudInstances) {
        Map<String, InstanceReport> reports = new LinkedHashMap<>();

        for (InstanceState state : states) {
            InstanceMetadata metadata = state.getMetadata();
            InstanceReport report = InstanceReport.builder()
                .instanceId(state.getInstanceId())
                .displayName(InstanceReport.UNKNOWN)
                .scaleStatus(scaleStatus(group.getType(), state.getStatus()))
                .cloudStatus(InstanceReport.UNKNOWN)
                .shuttingDown(state.isShuttingDown())
                .scaleDownProtected(false)
                .publicIp(metadata == null ? null : metadata.getPublicIp())
                .privateIp(metadata == null ? null : metadata.getPrivateIp())
                .build();
            reports.put(state.getInstanceId(), report);
        }

        for (CloudInstance cloudInstance : cloudInstances) {
            InstanceReport existing = reports.get(cloudInstance.getInstanceId());
            InstanceReport report;
            if (existing == null) {
                report = InstanceReport.builder()
                    .instanceId(cloudInstance.getInstanceId())
                    .displayName(cloudInstance.getDisplayName())
                    .scaleStatus(InstanceReport.UNKNOWN)
                    .cloudStatus(cloudInstance.getCloudStatus())
                    .shuttingDown(false)
                    .scaleDownProtected(false)
                    .build();
            } else {
                report = existing.toBuilder()
                    .displayName(cloudInstance.getDisplayName())
                    .cloudStatus(cloudInstance.getCloudStatus())
                    .build();
            }
            reports.put(cloudInstance.getInstanceId(), report);
        }

        return reports;
    }

    /**
     * Provisioning wins for every type; otherwise the group type decides how the sub-status reads.
     */
    static String scaleStatus(String groupType, InstanceStatus status) {
        if (status == null) {
            return InstanceReport.UNKNOWN;
        }
        if (status.isProvisioning()) {
            return InstanceReport.PROVISIONING;
        }
        switch (groupType) {
            case InstanceTypes.JIBRI:
                if (status.getJibriStatus() != null && status.getJibriStatus().getBusyStatus() != null) {
                    return status.getJibriStatus().getBusyStatus().name();
                }
                return InstanceReport.UNKNOWN;
            case InstanceTypes.JVB:
                // TODO: derive explicit statuses from JVB stats once the bridge reports them
                return InstanceReport.ONLINE;
            default:
                return InstanceReport.UNKNOWN;
        }
    }

    /**
     * Looks up shutdown and protection flags for all instances in parallel. An instance whose tracked
     * state already says it is shutting down skips the shutdown lookup. Output order follows input order.
     */
    private Mono<List<InstanceReport>> annotate(List<InstanceReport> instances) {
        return Flux.fromIterable(instances)
            .flatMapSequential(instance -> Mono.zip(
                    instance.isShuttingDown()
                        ? Mono.just(true)
                        : shutdownStatusProvider.getShutdownStatus(instance.getInstanceId()).defaultIfEmpty(false),
                    shutdownStatusProvider.isScaleDownProtected(instance.getInstanceId()).defaultIfEmpty(false))
                .map(flags -> instance.toBuilder()
                    .shuttingDown(flags.getT1())
                    .scaleDownProtected(flags.getT2())
                    .build()))
            .onErrorMap(dependencyFailure("instance status lookup"))
            .collectList();
    }

    static GroupReport fold(InstanceGroup group, int trackedCount, List<InstanceReport> instances) {
        int cloudCount = 0;
        int provisioningCount = 0;
        int availableCount = 0;
        int busyCount = 0;
        int unTrackedCount = 0;
        int shuttingDownCount = 0;
        int scaleDownProtectedCount = 0;

        for (InstanceReport instance : instances) {
            boolean live = CloudInstance.isLive(instance.getCloudStatus());
            if (live) {
                cloudCount++;
            }
            if (instance.isShuttingDown()) {
                shuttingDownCount++;
            }
            if (instance.isScaleDownProtected()) {
                scaleDownProtectedCount++;
            }
            if (InstanceReport.UNKNOWN.equals(instance.getScaleStatus()) && live) {
                unTrackedCount++;
            }
            if (InstanceReport.PROVISIONING.equals(instance.getScaleStatus())) {
                provisioningCount++;
            }
            if (InstanceTypes.JIBRI.equals(group.getType())) {
                if (JibriBusyStatus.IDLE.name().equals(instance.getScaleStatus())) {
                    availableCount++;
                }
                if (JibriBusyStatus.BUSY.name().equals(instance.getScaleStatus())) {
                    busyCount++;
                }
            }
        }

        return GroupReport.builder()
            .groupName(group.getName())
            .desiredCount(group.getScalingOptions() == null ? 0 : group.getScalingOptions().getDesiredCount())
            .count(trackedCount)
            .cloudCount(cloudCount)
            .provisioningCount(provisioningCount)
            .availableCount(availableCount)
            .busyCount(busyCount)
            .unTrackedCount(unTrackedCount)
            .shuttingDownCount(shuttingDownCount)
            .scaleDownProtectedCount(scaleDownProtectedCount)
            .instances(List.copyOf(instances))
            .build();
    }

    private static Function<Throwable, Throwable> dependencyFailure(String what) {
        return err -> err instanceof FleetException ? err : new DependencyException("Failed to fetch " + what, err);
    }
}
