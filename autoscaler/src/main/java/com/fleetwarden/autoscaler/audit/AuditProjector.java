package com.fleetwarden.autoscaler.audit;

import com.fleetwarden.core.audit.AutoScalerActionItem;
import com.fleetwarden.core.audit.AutoScalerActionReport;
import com.fleetwarden.core.audit.GroupAuditResponse;
import com.fleetwarden.core.audit.GroupEvent;
import com.fleetwarden.core.audit.InstanceAuditResponse;
import com.fleetwarden.core.audit.InstanceEvent;
import com.fleetwarden.core.audit.LauncherActionItem;
import com.fleetwarden.core.audit.LauncherActionReport;
import com.fleetwarden.core.model.InstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns raw audit events into operator-facing summaries. No I/O.
 */
public final class AuditProjector {
    private static final Logger log = LoggerFactory.getLogger(AuditProjector.class);

    public static final String UNKNOWN = "unknown";

    // e.g. "Tue, 03 Jun 2008 11:05:30 GMT"
    private static final DateTimeFormatter UTC_FORMAT =
        DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    private AuditProjector() {
    }

    public static String formatTimestamp(long epochMillis) {
        return UTC_FORMAT.format(Instant.ofEpochMilli(epochMillis));
    }

    /**
     * One summary per instance, in order of each instance's earliest event.
     * Events are applied oldest first, so for each field the newest event wins.
     */
    public static List<InstanceAuditResponse> projectInstanceAudit(List<InstanceEvent> events) {
        List<InstanceEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(InstanceEvent::getTimestamp));

        Map<String, InstanceAuditFold> folds = new LinkedHashMap<>();
        for (InstanceEvent event : sorted) {
            folds.computeIfAbsent(event.getInstanceId(), InstanceAuditFold::new).apply(event);
        }

        return folds.values().stream()
            .map(InstanceAuditFold::toResponse)
            .collect(Collectors.toList());
    }

    /**
     * Run markers plus action items, each action list ordered most recent first.
     */
    public static GroupAuditResponse projectGroupAudit(List<GroupEvent> events) {
        String lastLauncherRun = UNKNOWN;
        String lastAutoScalerRun = UNKNOWN;
        List<LauncherActionItem> launcherItems = new ArrayList<>();
        List<AutoScalerActionItem> autoScalerItems = new ArrayList<>();

        for (GroupEvent event : events) {
            switch (event.getType()) {
                case LAST_LAUNCHER_RUN -> lastLauncherRun = formatTimestamp(event.getTimestamp());
                case LAST_AUTOSCALER_RUN -> lastAutoScalerRun = formatTimestamp(event.getTimestamp());
                case LAUNCHER_ACTION_ITEM -> {
                    if (event.getLauncherActionItem() != null) {
                        launcherItems.add(event.getLauncherActionItem());
                    } else {
                        log.warn("Launcher action event of {} at {} has no item", event.getGroupName(), event.getTimestamp());
                    }
                }
                case AUTOSCALER_ACTION_ITEM -> {
                    if (event.getAutoScalerActionItem() != null) {
                        autoScalerItems.add(event.getAutoScalerActionItem());
                    } else {
                        log.warn("Autoscaler action event of {} at {} has no item", event.getGroupName(), event.getTimestamp());
                    }
                }
            }
        }

        List<LauncherActionReport> launcherActions = launcherItems.stream()
            .sorted(Comparator.comparingLong(LauncherActionItem::getTimestamp).reversed())
            .map(item -> LauncherActionReport.from(item, formatTimestamp(item.getTimestamp())))
            .collect(Collectors.toList());
        List<AutoScalerActionReport> autoScalerActions = autoScalerItems.stream()
            .sorted(Comparator.comparingLong(AutoScalerActionItem::getTimestamp).reversed())
            .map(item -> AutoScalerActionReport.from(item, formatTimestamp(item.getTimestamp())))
            .collect(Collectors.toList());

        return GroupAuditResponse.builder()
            .lastLauncherRun(lastLauncherRun)
            .lastAutoScalerRun(lastAutoScalerRun)
            .launcherActionItems(launcherActions)
            .autoScalerActionItems(autoScalerActions)
            .build();
    }

    private static final class InstanceAuditFold {
        private final String instanceId;
        private String requestToLaunch = UNKNOWN;
        private String requestToTerminate = UNKNOWN;
        private String latestStatus = UNKNOWN;
        private InstanceState latestStatusInfo;

        private InstanceAuditFold(String instanceId) {
            this.instanceId = instanceId;
        }

        private void apply(InstanceEvent event) {
            String formatted = formatTimestamp(event.getTimestamp());
            switch (event.getType()) {
                case LAUNCH_REQUESTED -> requestToLaunch = formatted;
                case TERMINATE_REQUESTED -> requestToTerminate = formatted;
                case LATEST_STATUS -> {
                    latestStatus = formatted;
                    latestStatusInfo = event.getState();
                }
            }
        }

        private InstanceAuditResponse toResponse() {
            return InstanceAuditResponse.builder()
                .instanceId(instanceId)
                .requestToLaunch(requestToLaunch)
                .requestToTerminate(requestToTerminate)
                .latestStatus(latestStatus)
                .latestStatusInfo(latestStatusInfo)
                .build();
        }
    }
}
