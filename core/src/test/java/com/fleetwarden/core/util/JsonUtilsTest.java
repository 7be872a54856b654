package com.fleetwarden.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetwarden.core.audit.GroupEventType;
import com.fleetwarden.core.audit.InstanceEvent;
import com.fleetwarden.core.audit.InstanceEventType;
import com.fleetwarden.core.model.JibriBusyStatus;
import com.fleetwarden.core.model.JibriStatus;
import com.fleetwarden.core.report.InstanceReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stored record shapes that other writers and readers depend on.
 */
class JsonUtilsTest {

    @Test
    @DisplayName("Instance events use wire type tags and omit absent state")
    void testInstanceEventShape() {
        InstanceEvent event = InstanceEvent.builder()
            .instanceId("i-1")
            .type(InstanceEventType.LAUNCH_REQUESTED)
            .timestamp(1700000000000L)
            .build();

        JsonNode node = JsonUtils.readTree(JsonUtils.writeValueAsString(event));

        assertEquals("request-to-launch", node.get("type").asText());
        assertEquals(1700000000000L, node.get("timestamp").asLong());
        assertFalse(node.has("state"));
    }

    @Test
    @DisplayName("Records from other writers decode despite unknown fields")
    void testUnknownFieldsTolerated() {
        String json = "{\"instanceId\":\"i-2\",\"type\":\"request-to-terminate\",\"timestamp\":5,\"extra\":true}";

        InstanceEvent event = JsonUtils.readValue(json, InstanceEvent.class);

        assertEquals("i-2", event.getInstanceId());
        assertEquals(InstanceEventType.TERMINATE_REQUESTED, event.getType());
        assertEquals(5L, event.getTimestamp());
    }

    @Test
    @DisplayName("Unknown jibri busy status falls back to UNKNOWN")
    void testUnknownBusyStatus() {
        JibriStatus status = JsonUtils.readValue("{\"busyStatus\":\"SLEEPING\"}", JibriStatus.class);

        assertEquals(JibriBusyStatus.UNKNOWN, status.getBusyStatus());
    }

    @Test
    @DisplayName("Instance reports expose the is-prefixed flag names")
    void testInstanceReportFlags() {
        InstanceReport report = InstanceReport.builder()
            .instanceId("i-3")
            .scaleStatus(InstanceReport.ONLINE)
            .cloudStatus("Running")
            .shuttingDown(true)
            .build();

        JsonNode node = JsonUtils.readTree(JsonUtils.writeValueAsString(report));

        assertTrue(node.get("isShuttingDown").asBoolean());
        assertFalse(node.get("isScaleDownProtected").asBoolean());
        assertFalse(node.has("shuttingDown"));
    }

    @Test
    @DisplayName("Group event tags keep their mixed-case wire names")
    void testGroupEventWireNames() {
        assertEquals("\"last-autoScaler-run\"", JsonUtils.writeValueAsString(GroupEventType.LAST_AUTOSCALER_RUN));
        assertEquals(GroupEventType.AUTOSCALER_ACTION_ITEM,
            GroupEventType.fromWireName("autoScaler-action-item").orElseThrow());
        assertTrue(InstanceEventType.fromWireName("last-launcher-run").isEmpty());
    }

    @Test
    @DisplayName("Malformed JSON is reported as IllegalArgumentException")
    void testMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.readValue("{not json", InstanceEvent.class));
    }
}
