package com.fleetwarden.core.redis;

/**
 * Redis keyspace definitions for instance flags and the audit trail.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions ({@code instance:}, {@code audit:})</li>
 *   <li>Every key carries a TTL; nothing here is meant to live forever</li>
 *   <li>Values are plain strings: a sentinel for flags, JSON for everything else</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    public static final String SHUTDOWN_SENTINEL = "shutdown";

    /**
     * Shutdown flag: {@code instance:shutdown:{instanceId}}
     * <p>
     * <b>Type:</b> String, {@value #SHUTDOWN_SENTINEL} when the instance is draining
     * <br>
     * <b>TTL:</b> 900s, rewritten on every report
     * </p>
     */
    public static String shutdown(String instanceId) {
        return instance("shutdown", instanceId);
    }

    /**
     * Opaque stats blob: {@code instance:stats:{instanceId}}
     * <p>
     * <b>Type:</b> String (JSON, stored verbatim)
     * <br>
     * <b>TTL:</b> 900s
     * </p>
     */
    public static String stats(String instanceId) {
        return instance("stats", instanceId);
    }

    /**
     * Scale-down protection flag: {@code instance:scaleDownProtected:{instanceId}}
     */
    public static String scaleDownProtected(String instanceId) {
        return instance("scaleDownProtected", instanceId);
    }

    private static String instance(String type, String instanceId) {
        return "instance:" + type + ":" + instanceId;
    }

    /**
     * Per-instance audit event: {@code audit:{group}:{instanceId}:{type}}
     * <p>
     * <b>Type:</b> String (JSON instance event)
     * <br>
     * <b>TTL:</b> audit TTL; launch and terminate markers are refreshed on every status update
     * </p>
     */
    public static String instanceAudit(String group, String instanceId, String type) {
        return "audit:" + group + ":" + instanceId + ":" + type;
    }

    /**
     * Group run marker: {@code audit:{group}:{type}}, overwritten on each run.
     */
    public static String groupAudit(String group, String type) {
        return "audit:" + group + ":" + type;
    }

    /**
     * Group action item: {@code audit:{group}:{type}:{timestamp}}, one key per decision.
     */
    public static String groupAudit(String group, String type, long timestamp) {
        return groupAudit(group, type) + ":" + timestamp;
    }

    /**
     * SCAN match pattern covering every per-instance audit key of a group.
     */
    public static String instanceAuditPattern(String group) {
        return "audit:" + escapeGlob(group) + ":*:*";
    }

    /**
     * SCAN match pattern covering every audit key of a group.
     */
    public static String groupAuditPattern(String group) {
        return "audit:" + escapeGlob(group) + ":*";
    }

    /**
     * Escapes SCAN glob metacharacters ({@code * ? [ ] \}) so a literal becomes an exact-match pattern part.
     */
    public static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
