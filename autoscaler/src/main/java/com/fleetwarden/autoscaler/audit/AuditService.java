package com.fleetwarden.autoscaler.audit;

import com.fleetwarden.core.audit.GroupAuditResponse;
import com.fleetwarden.core.audit.InstanceAuditResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Audit read side: raw events from {@link AuditStore}, summarized by {@link AuditProjector}.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditStore auditStore;

    public AuditService(AuditStore auditStore) {
        this.auditStore = auditStore;
    }

    public Mono<List<InstanceAuditResponse>> generateInstanceAudit(String groupName) {
        return auditStore.getInstanceAudit(groupName)
            .map(AuditProjector::projectInstanceAudit)
            .doOnNext(audit -> log.debug("Generated instance audit for {}: {} instances", groupName, audit.size()));
    }

    public Mono<GroupAuditResponse> generateGroupAudit(String groupName) {
        return auditStore.getGroupAudit(groupName)
            .map(AuditProjector::projectGroupAudit)
            .doOnNext(audit -> log.debug("Generated group audit for {}: {} launcher / {} autoscaler actions",
                groupName, audit.getLauncherActionItems().size(), audit.getAutoScalerActionItems().size()));
    }
}
